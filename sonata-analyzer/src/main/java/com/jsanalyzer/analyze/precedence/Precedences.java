package com.jsanalyzer.analyze.precedence;

import com.jsanalyzer.ast.*;

/**
 * Assigns an {@link OperatorPrecedence} to every expression.
 */
public final class Precedences {
    private Precedences() {
    }

    public static OperatorPrecedence of(Expression expression) {
        return switch (ExpressionKind.of(expression)) {
            case SEQUENCE, SPREAD -> OperatorPrecedence.COMMA;
            case YIELD -> OperatorPrecedence.YIELD;
            // An arrow function cannot be an operand without parentheses
            case ASSIGNMENT, ARROW_FUNCTION -> OperatorPrecedence.ASSIGNMENT;
            case CONDITIONAL -> OperatorPrecedence.CONDITIONAL;
            case BINARY -> OperatorPrecedence.ofBinaryOperator(((BinaryExpression) expression).operator());
            case LOGICAL -> OperatorPrecedence.ofBinaryOperator(((LogicalExpression) expression).operator());
            case IN -> OperatorPrecedence.RELATIONAL;
            case UNARY, AWAIT -> OperatorPrecedence.UNARY;
            case PRE_UPDATE, POST_UPDATE -> OperatorPrecedence.UPDATE;
            case CALL, SUPER -> OperatorPrecedence.LEFT_HAND_SIDE;
            case NEW -> ((NewExpression) expression).arguments().isEmpty()
                ? OperatorPrecedence.NEW
                : OperatorPrecedence.MEMBER;
            case STATIC_MEMBER, COMPUTED_MEMBER, META_PROPERTY, TAGGED_TEMPLATE -> OperatorPrecedence.MEMBER;
            case IDENTIFIER, LITERAL, THIS, ARRAY, OBJECT, FUNCTION, CLASS, TEMPLATE -> OperatorPrecedence.PRIMARY;
            case PARENTHESIZED -> OperatorPrecedence.GROUP;
        };
    }

    /**
     * Strips any number of enclosing parentheses.
     */
    public static Expression omitParentheses(Expression expression) {
        Expression current = expression;
        while (current instanceof ParenthesizedExpression parenthesized) {
            current = parenthesized.expression();
        }
        return current;
    }
}
