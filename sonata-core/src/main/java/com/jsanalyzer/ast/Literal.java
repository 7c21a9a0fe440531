package com.jsanalyzer.ast;

public record Literal(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Object value,                // Double, String, Boolean or null
    String raw
) implements Expression {
    public Literal(Object value, String raw) {
        this(0, 0, 0, 0, 0, 0, value, raw);
    }

    @Override
    public String type() {
        return "Literal";
    }
}
