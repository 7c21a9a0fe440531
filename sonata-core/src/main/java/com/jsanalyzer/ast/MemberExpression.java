package com.jsanalyzer.ast;

public record MemberExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression object,
    Expression property,
    boolean computed,
    boolean optional
) implements Expression, Pattern {
    public MemberExpression(Expression object, Expression property, boolean computed) {
        this(0, 0, 0, 0, 0, 0, object, property, computed, false);
    }

    @Override
    public String type() {
        return "MemberExpression";
    }
}
