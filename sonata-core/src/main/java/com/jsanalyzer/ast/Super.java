package com.jsanalyzer.ast;

public record Super(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol
) implements Expression {
    public Super() {
        this(0, 0, 0, 0, 0, 0);
    }

    @Override
    public String type() {
        return "Super";
    }
}
