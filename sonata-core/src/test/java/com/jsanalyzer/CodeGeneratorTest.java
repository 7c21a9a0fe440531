package com.jsanalyzer;

import com.jsanalyzer.ast.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CodeGeneratorTest {

    private static String print(String source) {
        return CodeGenerator.generate(Parser.parse(source));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "const foo = 2 ** 8;",
        "let quux = (-1) ** n;",
        "(a ** b) ** c;",
        "a ?? (b || c);",
        "x = typeof a === \"string\" ? a.b?.[c] : new Foo(...d);",
        "f`a${b}c`;",
        "- -x;",
        "a++ + ++b;",
        "class C extends (a ** b) {}",
        "var g = async function*() {};",
        "o = { a: 1, b, [c]: d };",
        "new.target;"
    })
    void printsSingleLineSourceUnchanged(String source) {
        assertEquals(source, print(source));
    }

    @Test
    void blocksAreIndented() {
        String source = String.join("\n",
            "function f(a, b) {",
            "  if (a) {",
            "    return a ** b;",
            "  } else {}",
            "}",
            "class K {",
            "  static m() {",
            "    return;",
            "  }",
            "}");
        assertEquals(source, print(source));
    }

    @Test
    void arrowsPrintSingleParameterBare() {
        assertEquals("f = x => x * 2;", print("f = (x) => x * 2;"));
        assertEquals("f = (a, b) => {};", print("f = (a,b)=>{}"));
    }

    @Test
    void synthesizedNodesArePrintedFromValues() {
        BinaryExpression power = new BinaryExpression("**", new Literal(2.0, null), new Literal("x\"y", null));
        assertEquals("2 ** \"x\\\"y\"", CodeGenerator.generate(power));
        assertEquals("1.5", CodeGenerator.literalText(1.5));
        assertEquals("null", CodeGenerator.literalText(null));
        assertEquals("true", CodeGenerator.literalText(Boolean.TRUE));
    }

    @Test
    void noParenthesesAreInventedForSynthesizedTrees() {
        BinaryExpression sum = new BinaryExpression("+", new Identifier("a"), new Identifier("b"));
        BinaryExpression power = new BinaryExpression("**", sum, new Identifier("c"));
        assertEquals("a + b ** c", CodeGenerator.generate(power));
        ParenthesizedExpression grouped = new ParenthesizedExpression(sum);
        assertEquals("(a + b) ** c",
            CodeGenerator.generate(new BinaryExpression("**", grouped, new Identifier("c"))));
    }

    @Test
    void unaryMinusBeforeNegativeLiteralIsSpaced() {
        UnaryExpression negation = new UnaryExpression("-", new Literal(-1.0, null));
        assertEquals("- -1", CodeGenerator.generate(negation));
        assertEquals("void 0", print("void 0;").replace(";", ""));
    }

    @Test
    void printsEveryStatementOfAProgram() {
        Program program = new Program(0, 0, 0, 0, 0, 0, List.of(
            new ExpressionStatement(new Identifier("a")),
            new EmptyStatement()), "script");
        assertEquals("a;\n;", CodeGenerator.generate(program));
    }
}
