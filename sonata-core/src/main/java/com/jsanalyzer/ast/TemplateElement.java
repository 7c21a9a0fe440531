package com.jsanalyzer.ast;

public record TemplateElement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    TemplateElementValue value,
    boolean tail
) implements Node {
    public TemplateElement(TemplateElementValue value, boolean tail) {
        this(0, 0, 0, 0, 0, 0, value, tail);
    }

    @Override
    public String type() {
        return "TemplateElement";
    }

    public record TemplateElementValue(
        String raw,
        String cooked
    ) {}
}
