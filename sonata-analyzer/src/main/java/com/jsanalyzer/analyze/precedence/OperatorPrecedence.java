package com.jsanalyzer.analyze.precedence;

/**
 * Operator precedence levels, ordered from the loosest binding to the tightest.
 *
 * <p>Levels compare by declaration order, so {@code compareTo} answers "binds tighter
 * than". {@link #EXPONENTIAL} is the only right-associative level.</p>
 */
public enum OperatorPrecedence {
    COMMA,
    YIELD,
    ASSIGNMENT,
    CONDITIONAL,
    COALESCE,
    LOGICAL_OR,
    LOGICAL_AND,
    BITWISE_OR,
    BITWISE_XOR,
    BITWISE_AND,
    EQUALITY,
    RELATIONAL,
    SHIFT,
    ADDITIVE,
    MULTIPLICATIVE,
    EXPONENTIAL,
    UNARY,
    UPDATE,
    LEFT_HAND_SIDE,
    NEW,
    MEMBER,
    PRIMARY,
    GROUP;

    public boolean isRightAssociative() {
        return this == EXPONENTIAL;
    }

    public boolean isLeftAssociative() {
        return !isRightAssociative();
    }

    public boolean isBindingTighterThan(OperatorPrecedence other) {
        return compareTo(other) > 0;
    }

    public boolean isAtLeast(OperatorPrecedence other) {
        return compareTo(other) >= 0;
    }

    /**
     * Returns the level of a binary or logical operator.
     *
     * @throws IllegalArgumentException if {@code operator} is not a binary operator
     */
    public static OperatorPrecedence ofBinaryOperator(String operator) {
        return switch (operator) {
            case "??" -> COALESCE;
            case "||" -> LOGICAL_OR;
            case "&&" -> LOGICAL_AND;
            case "|" -> BITWISE_OR;
            case "^" -> BITWISE_XOR;
            case "&" -> BITWISE_AND;
            case "==", "!=", "===", "!==" -> EQUALITY;
            case "<", "<=", ">", ">=", "in", "instanceof" -> RELATIONAL;
            case "<<", ">>", ">>>" -> SHIFT;
            case "+", "-" -> ADDITIVE;
            case "*", "/", "%" -> MULTIPLICATIVE;
            case "**" -> EXPONENTIAL;
            default -> throw new IllegalArgumentException("Not a binary operator: " + operator);
        };
    }
}
