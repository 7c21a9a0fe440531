package com.jsanalyzer.ast;

import java.util.List;

public record TemplateLiteral(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<TemplateElement> quasis,
    List<Expression> expressions
) implements Expression {
    public TemplateLiteral(List<TemplateElement> quasis, List<Expression> expressions) {
        this(0, 0, 0, 0, 0, 0, quasis, expressions);
    }

    @Override
    public String type() {
        return "TemplateLiteral";
    }
}
