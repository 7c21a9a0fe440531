package com.jsanalyzer.ast;

public record Property(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression key,
    Expression value,
    boolean computed,
    boolean shorthand
) implements Node {
    public Property(Expression key, Expression value, boolean computed, boolean shorthand) {
        this(0, 0, 0, 0, 0, 0, key, value, computed, shorthand);
    }

    @Override
    public String type() {
        return "Property";
    }
}
