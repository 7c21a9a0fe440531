package com.jsanalyzer.ast;

public record ParenthesizedExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression expression
) implements Expression {
    public ParenthesizedExpression(Expression expression) {
        this(0, 0, 0, 0, 0, 0, expression);
    }

    @Override
    public String type() {
        return "ParenthesizedExpression";
    }
}
