package com.jsanalyzer.ast;

public record UpdateExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String operator,             // "++" | "--"
    boolean prefix,              // true for ++x, false for x++
    Expression argument
) implements Expression {
    public UpdateExpression(String operator, boolean prefix, Expression argument) {
        this(0, 0, 0, 0, 0, 0, operator, prefix, argument);
    }

    @Override
    public String type() {
        return "UpdateExpression";
    }
}
