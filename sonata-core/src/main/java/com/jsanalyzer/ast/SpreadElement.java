package com.jsanalyzer.ast;

public record SpreadElement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression argument
) implements Expression {
    public SpreadElement(Expression argument) {
        this(0, 0, 0, 0, 0, 0, argument);
    }

    @Override
    public String type() {
        return "SpreadElement";
    }
}
