package com.jsanalyzer.ast;

public record YieldExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression argument,         // Can be null
    boolean delegate
) implements Expression {
    public YieldExpression(Expression argument, boolean delegate) {
        this(0, 0, 0, 0, 0, 0, argument, delegate);
    }

    @Override
    public String type() {
        return "YieldExpression";
    }
}
