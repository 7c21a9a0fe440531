package com.jsanalyzer.ast;

public record LogicalExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String operator,             // "||" | "&&" | "??"
    Expression left,
    Expression right
) implements Expression {
    public LogicalExpression(String operator, Expression left, Expression right) {
        this(0, 0, 0, 0, 0, 0, operator, left, right);
    }

    @Override
    public String type() {
        return "LogicalExpression";
    }
}
