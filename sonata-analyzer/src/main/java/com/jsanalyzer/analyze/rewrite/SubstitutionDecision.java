package com.jsanalyzer.analyze.rewrite;

import com.jsanalyzer.ast.Expression;

import java.util.Optional;

/**
 * Where parentheses must go when a node is replaced by a new operator expression.
 *
 * @param wrapReplacement whether the new expression itself must be parenthesized
 * @param parentToWrap an enclosing expression that must be parenthesized as well
 */
public record SubstitutionDecision(boolean wrapReplacement, Optional<Expression> parentToWrap) {
    private static final SubstitutionDecision NONE = new SubstitutionDecision(false, Optional.empty());
    private static final SubstitutionDecision WRAP = new SubstitutionDecision(true, Optional.empty());

    public static SubstitutionDecision none() {
        return NONE;
    }

    public static SubstitutionDecision wrap() {
        return WRAP;
    }

    public static SubstitutionDecision wrapWithParent(Expression parent) {
        return new SubstitutionDecision(true, Optional.of(parent));
    }
}
