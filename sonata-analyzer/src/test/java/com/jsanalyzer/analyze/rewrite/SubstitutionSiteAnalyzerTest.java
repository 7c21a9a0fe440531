package com.jsanalyzer.analyze.rewrite;

import com.jsanalyzer.analyze.AstShapes;
import com.jsanalyzer.analyze.syntax.SyntaxTree;
import com.jsanalyzer.ast.CallExpression;
import com.jsanalyzer.ast.ClassExpression;
import com.jsanalyzer.ast.Expression;
import com.jsanalyzer.ast.Identifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SubstitutionSiteAnalyzerTest {
    private final SubstitutionSiteAnalyzer analyzer = new SubstitutionSiteAnalyzer();

    private SubstitutionDecision decide(String source) {
        SyntaxTree tree = SyntaxTree.parse(source);
        Expression node = AstShapes.firstCall(tree, "m");
        return analyzer.analyze(tree, node, "**").orElseThrow();
    }

    @ParameterizedTest(name = "{0} -> wrap {1}")
    @CsvSource(delimiter = '|', value = {
        "m() ** c;                         | true",
        "c ** m();                         | false",
        "m() * c;                          | false",
        "a * m();                          | false",
        "a + m();                          | false",
        "-m();                             | true",
        "typeof m();                       | true",
        "m().x;                            | true",
        "m()[k];                           | true",
        "o[m()];                           | false",
        "m()(x);                           | true",
        "f(m());                           | false",
        "new F(m());                       | false",
        "(m());                            | false",
        "m() in o;                         | true",
        "a + m() in o;                     | true",
        "`${m()}`;                         | true",
        "tag`${m()}`;                      | true",
        "const v = m();                    | false",
        "v = m();                          | false",
        "a ? m() : b;                      | false",
        "'a || m();'                       | false",
        "[m()];                            | false",
        "f(...m());                        | false",
        "async function f() { await m(); } | true",
        "class C extends m() {}            | true"
    })
    void wrapsReplacement(String source, boolean expected) {
        SubstitutionDecision decision = decide(source);
        assertEquals(expected, decision.wrapReplacement());
        assertTrue(decision.parentToWrap().isEmpty());
    }

    @Test
    void classExpressionOwnerIsWrappedToo() {
        SyntaxTree tree = SyntaxTree.parse("x = class extends m() {};");
        SubstitutionDecision decision = analyzer.analyze(tree, AstShapes.firstCall(tree, "m"), "**").orElseThrow();
        assertTrue(decision.wrapReplacement());
        assertInstanceOf(ClassExpression.class, decision.parentToWrap().orElseThrow());
    }

    @Test
    void parenthesizedClassExpressionIsNotWrappedAgain() {
        SubstitutionDecision decision = decide("x = (class extends m() {});");
        assertTrue(decision.wrapReplacement());
        assertTrue(decision.parentToWrap().isEmpty());
    }

    @Test
    void sameOperatorOnAssociativeSideIsSafe() {
        SyntaxTree tree = SyntaxTree.parse("a - m();");
        Expression node = AstShapes.firstCall(tree, "m");
        assertTrue(analyzer.analyze(tree, node, "-").orElseThrow().wrapReplacement());

        tree = SyntaxTree.parse("m() - a;");
        node = AstShapes.firstCall(tree, "m");
        assertFalse(analyzer.analyze(tree, node, "-").orElseThrow().wrapReplacement());
    }

    @ParameterizedTest(name = "{0} with {1} -> wrap {2}")
    @CsvSource(delimiter = '|', value = {
        "x && m();  | '||'  | true",
        "m() && x;  | '||'  | true",
        "'x || m();'  | &&  | false",
        "'x || m();'  | '||'  | true",
        "'m() || x;'  | '||'  | false",
        "x ?? m();  | &&  | true",
        "m() ?? x;  | '||'  | true",
        "x && m();  | ??  | true",
        "x ?? m();  | ??  | true",
        "m() ?? x;  | ??  | false",
        "m() + x;   | ??  | true"
    })
    void logicalParents(String source, String operator, boolean expected) {
        SyntaxTree tree = SyntaxTree.parse(source);
        Expression node = AstShapes.firstCall(tree, "m");
        assertEquals(expected, analyzer.analyze(tree, node, operator).orElseThrow().wrapReplacement());
    }

    @ParameterizedTest(name = "{0} -> leading wrap {1}")
    @CsvSource(delimiter = '|', value = {
        "m({a: 2}.a, 3);                        | true",
        "m({a: 2}.a, 3) + 1;                    | true",
        "m(function () { return 2; }(), 3);     | true",
        "m(class {}.length, 3);                 | true",
        "x = m({a: 2}.a, 3);                    | false",
        "f(m({a: 2}.a, 3));                     | false",
        "m(a.b, 3);                             | false",
        "const f = () => m({a: 2}.a, 3);        | true",
        "const g = () => m(function () {}.length, 2); | false",
        "const h = () => m(class {}.name, 2);   | false"
    })
    void leadingTokenOfStatement(String source, boolean expected) {
        SyntaxTree tree = SyntaxTree.parse(source);
        CallExpression call = (CallExpression) AstShapes.firstCall(tree, "m");
        Expression replacement = AstFactory.binary(call.arguments().get(0), "**", call.arguments().get(1));
        assertEquals(expected, analyzer.needsLeadingParentheses(tree, call, replacement));
    }

    @Test
    void nodeOutsideTheTreeCannotBeDecided() {
        SyntaxTree tree = SyntaxTree.parse("m();");
        CallExpression detached = new CallExpression(new Identifier("m"), List.of());
        assertEquals(Optional.empty(), analyzer.analyze(tree, detached, "**"));
    }
}
