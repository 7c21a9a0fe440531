package com.jsanalyzer.ast;

public record MetaProperty(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier meta,
    Identifier property
) implements Expression {
    public MetaProperty(Identifier meta, Identifier property) {
        this(0, 0, 0, 0, 0, 0, meta, property);
    }

    @Override
    public String type() {
        return "MetaProperty";
    }
}
