package com.jsanalyzer.analyze.precedence;

import com.jsanalyzer.analyze.AstShapes;
import com.jsanalyzer.analyze.syntax.SyntaxTree;
import com.jsanalyzer.ast.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PrecedencesTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "a, b               | COMMA",
        "a = b              | ASSIGNMENT",
        "a **= b            | ASSIGNMENT",
        "x => x             | ASSIGNMENT",
        "a ? b : c          | CONDITIONAL",
        "a ?? b             | COALESCE",
        "'a || b'           | LOGICAL_OR",
        "a && b             | LOGICAL_AND",
        "'a | b'            | BITWISE_OR",
        "a ^ b              | BITWISE_XOR",
        "a & b              | BITWISE_AND",
        "a !== b            | EQUALITY",
        "a in b             | RELATIONAL",
        "a instanceof b     | RELATIONAL",
        "a >>> b            | SHIFT",
        "a - b              | ADDITIVE",
        "a % b              | MULTIPLICATIVE",
        "a ** b             | EXPONENTIAL",
        "-a                 | UNARY",
        "typeof a           | UNARY",
        "a++                | UPDATE",
        "--a                | UPDATE",
        "f()                | LEFT_HAND_SIDE",
        "new F(x)           | MEMBER",
        "new F              | NEW",
        "a.b                | MEMBER",
        "a[b]               | MEMBER",
        "new.target         | MEMBER",
        "tag`t`             | MEMBER",
        "`t`                | PRIMARY",
        "a                  | PRIMARY",
        "1                  | PRIMARY",
        "this               | PRIMARY",
        "[a]                | PRIMARY",
        "(a + b)            | GROUP"
    })
    void precedenceOfExpression(String source, OperatorPrecedence expected) {
        Expression expression = AstShapes.expression(SyntaxTree.parse(source));
        assertEquals(expected, Precedences.of(expression));
    }

    @Test
    void yieldAndAwaitInsideFunctions() {
        SyntaxTree tree = SyntaxTree.parse("async function f() { await a; }\nfunction* g() { yield a; }");
        List<OperatorPrecedence> levels = tree.descendants()
            .filter(node -> node instanceof AwaitExpression || node instanceof YieldExpression)
            .map(node -> Precedences.of((Expression) node))
            .toList();
        assertEquals(List.of(OperatorPrecedence.UNARY, OperatorPrecedence.YIELD), levels);
    }

    @Test
    void inIsItsOwnKind() {
        assertEquals(ExpressionKind.IN, ExpressionKind.of(new BinaryExpression("in", new Identifier("a"), new Identifier("b"))));
        assertEquals(ExpressionKind.BINARY, ExpressionKind.of(new BinaryExpression("+", new Identifier("a"), new Identifier("b"))));
        assertEquals(ExpressionKind.COMPUTED_MEMBER,
            ExpressionKind.of(new MemberExpression(new Identifier("a"), new Identifier("b"), true)));
        assertEquals(ExpressionKind.POST_UPDATE, ExpressionKind.of(new UpdateExpression("++", false, new Identifier("a"))));
    }

    @Test
    void levelsAreTotallyOrdered() {
        assertTrue(OperatorPrecedence.EXPONENTIAL.isBindingTighterThan(OperatorPrecedence.MULTIPLICATIVE));
        assertTrue(OperatorPrecedence.UNARY.isBindingTighterThan(OperatorPrecedence.EXPONENTIAL));
        assertTrue(OperatorPrecedence.GROUP.isAtLeast(OperatorPrecedence.PRIMARY));
        assertTrue(OperatorPrecedence.COMMA.compareTo(OperatorPrecedence.YIELD) < 0);
        assertEquals(OperatorPrecedence.GROUP, OperatorPrecedence.values()[OperatorPrecedence.values().length - 1]);
    }

    @Test
    void onlyExponentialIsRightAssociative() {
        for (OperatorPrecedence level : OperatorPrecedence.values()) {
            assertEquals(level == OperatorPrecedence.EXPONENTIAL, level.isRightAssociative(), level.name());
        }
    }

    @Test
    void unknownOperatorIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> OperatorPrecedence.ofBinaryOperator("=>"));
        assertThrows(IllegalArgumentException.class, () -> OperatorPrecedence.ofBinaryOperator("!"));
    }

    @Test
    void omitParenthesesStripsEveryLevel() {
        Expression expression = AstShapes.expression(SyntaxTree.parse("((a))"));
        assertInstanceOf(Identifier.class, Precedences.omitParentheses(expression));
    }
}
