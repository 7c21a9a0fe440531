package com.jsanalyzer.ast;

public record Identifier(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String name
) implements Expression, Pattern {
    public Identifier(String name) {
        this(0, 0, 0, 0, 0, 0, name);
    }

    @Override
    public String type() {
        return "Identifier";
    }
}
