package com.jsanalyzer.ast;

public record ReturnStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression argument          // Can be null
) implements Statement {
    public ReturnStatement(Expression argument) {
        this(0, 0, 0, 0, 0, 0, argument);
    }

    @Override
    public String type() {
        return "ReturnStatement";
    }
}
