package com.jsanalyzer.ast;

import java.util.List;

public record SequenceExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Expression> expressions
) implements Expression {
    public SequenceExpression(List<Expression> expressions) {
        this(0, 0, 0, 0, 0, 0, expressions);
    }

    @Override
    public String type() {
        return "SequenceExpression";
    }
}
