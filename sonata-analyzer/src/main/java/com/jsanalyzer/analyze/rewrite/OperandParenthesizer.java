package com.jsanalyzer.analyze.rewrite;

import com.jsanalyzer.analyze.precedence.ExpressionKind;
import com.jsanalyzer.analyze.precedence.OperatorPrecedence;
import com.jsanalyzer.analyze.precedence.Precedences;
import com.jsanalyzer.ast.Expression;
import com.jsanalyzer.ast.LogicalExpression;

/**
 * Decides whether an expression placed as an operand of a new binary operator needs
 * parentheses to keep its grouping.
 */
public final class OperandParenthesizer {
    private final ParenthesizationPolicy policy;

    public OperandParenthesizer() {
        this(ParenthesizationPolicy.READABLE);
    }

    public OperandParenthesizer(ParenthesizationPolicy policy) {
        this.policy = policy;
    }

    public ParenthesizationPolicy policy() {
        return policy;
    }

    /**
     * An operand on the side the operator associates towards may share the operator's level;
     * on the other side it must bind strictly tighter. For {@code **} that means the base is
     * wrapped at equal precedence and the exponent is not.
     */
    public boolean needsParentheses(Expression operand, OperandSide side, String operator) {
        OperatorPrecedence level = OperatorPrecedence.ofBinaryOperator(operator);
        OperatorPrecedence own = Precedences.of(operand);
        if (level == OperatorPrecedence.EXPONENTIAL && side == OperandSide.LEFT && isForbiddenBeforeExponent(operand)) {
            return true;
        }
        if (operand instanceof LogicalExpression logical && mixesCoalescing(operator, logical.operator())) {
            return true;
        }
        OperandSide associativeSide = level.isRightAssociative() ? OperandSide.RIGHT : OperandSide.LEFT;
        if (side == associativeSide) {
            return own.compareTo(level) < 0;
        }
        return own.compareTo(level) <= 0;
    }

    /**
     * Whether one of the two logical operators is {@code ??} and the other {@code &&} or
     * {@code ||}, a combination the grammar only accepts with parentheses.
     */
    static boolean mixesCoalescing(String outer, String inner) {
        boolean outerCoalesce = outer.equals("??");
        boolean innerCoalesce = inner.equals("??");
        if (outerCoalesce == innerCoalesce) {
            return false;
        }
        String other = outerCoalesce ? inner : outer;
        return other.equals("&&") || other.equals("||");
    }

    private boolean isForbiddenBeforeExponent(Expression base) {
        return switch (ExpressionKind.of(base)) {
            case UNARY, AWAIT -> true;
            case PRE_UPDATE, POST_UPDATE -> policy == ParenthesizationPolicy.READABLE;
            case IDENTIFIER, LITERAL, THIS, SUPER, ARRAY, OBJECT, FUNCTION, ARROW_FUNCTION, CLASS, TEMPLATE,
                 TAGGED_TEMPLATE, STATIC_MEMBER, COMPUTED_MEMBER, META_PROPERTY, CALL, NEW, BINARY, IN, LOGICAL,
                 CONDITIONAL, ASSIGNMENT, SEQUENCE, YIELD, SPREAD, PARENTHESIZED -> false;
        };
    }
}
