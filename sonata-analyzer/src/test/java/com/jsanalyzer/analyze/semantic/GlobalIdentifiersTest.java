package com.jsanalyzer.analyze.semantic;

import com.jsanalyzer.analyze.AstShapes;
import com.jsanalyzer.analyze.syntax.SyntaxTree;
import com.jsanalyzer.ast.Expression;
import com.jsanalyzer.ast.MemberExpression;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class GlobalIdentifiersTest {

    private static Expression expression(String source) {
        return AstShapes.expression(SyntaxTree.parse(source));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
        "Math                  | Math       | Math",
        "(Math)                | Math       | Math",
        "globalThis.Math       | Math       | globalThis",
        "window.Math           | Math       | window",
        "globalThis['Math']    | Math       | globalThis",
        "(globalThis).Math     | Math       | globalThis"
    })
    void recognizesGlobals(String source, String name, String reference) {
        GlobalReference global = GlobalIdentifiers.globalIdentifier(expression(source)).orElseThrow();
        assertEquals(name, global.name());
        assertEquals(reference, global.reference().name());
    }

    @ParameterizedTest
    @ValueSource(strings = {"self.Math", "a.b.Math", "globalThis[name]", "f()", "this.Math"})
    void rejectsOtherExpressions(String source) {
        assertEquals(Optional.empty(), GlobalIdentifiers.globalIdentifier(expression(source)));
    }

    @Test
    void memberNames() {
        assertEquals(Optional.of("pow"), GlobalIdentifiers.memberName((MemberExpression) expression("Math.pow")));
        assertEquals(Optional.of("pow"), GlobalIdentifiers.memberName((MemberExpression) expression("Math['pow']")));
        assertEquals(Optional.of("pow"), GlobalIdentifiers.memberName((MemberExpression) expression("Math[\"pow\"]")));
        assertEquals(Optional.of("pow"), GlobalIdentifiers.memberName((MemberExpression) expression("Math[`pow`]")));
        assertEquals(Optional.of("pow"), GlobalIdentifiers.memberName((MemberExpression) expression("Math[('pow')]")));
        assertEquals(Optional.empty(), GlobalIdentifiers.memberName((MemberExpression) expression("Math[`${p}`]")));
        assertEquals(Optional.empty(), GlobalIdentifiers.memberName((MemberExpression) expression("Math[p]")));
        assertEquals(Optional.empty(), GlobalIdentifiers.memberName((MemberExpression) expression("Math[1]")));
    }
}
