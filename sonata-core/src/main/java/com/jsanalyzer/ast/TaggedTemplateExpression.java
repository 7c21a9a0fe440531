package com.jsanalyzer.ast;

public record TaggedTemplateExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression tag,
    TemplateLiteral quasi
) implements Expression {
    public TaggedTemplateExpression(Expression tag, TemplateLiteral quasi) {
        this(0, 0, 0, 0, 0, 0, tag, quasi);
    }

    @Override
    public String type() {
        return "TaggedTemplateExpression";
    }
}
