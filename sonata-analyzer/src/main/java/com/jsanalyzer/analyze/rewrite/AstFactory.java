package com.jsanalyzer.analyze.rewrite;

import com.jsanalyzer.ast.BinaryExpression;
import com.jsanalyzer.ast.Expression;
import com.jsanalyzer.ast.LogicalExpression;
import com.jsanalyzer.ast.ParenthesizedExpression;

/**
 * Builds synthesized expression nodes. Synthesized nodes carry zero positions.
 */
public final class AstFactory {
    private AstFactory() {
    }

    public static Expression binary(Expression left, String operator, Expression right) {
        return switch (operator) {
            case "&&", "||", "??" -> new LogicalExpression(operator, left, right);
            default -> new BinaryExpression(operator, left, right);
        };
    }

    /**
     * Wraps {@code expression} in parentheses unless it already is parenthesized.
     */
    public static Expression parenthesized(Expression expression) {
        if (expression instanceof ParenthesizedExpression) {
            return expression;
        }
        return new ParenthesizedExpression(expression);
    }
}
