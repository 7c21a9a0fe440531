package com.jsanalyzer.ast;

import java.util.List;

public record ArrowFunctionExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    boolean expression,          // true when body is an expression
    boolean async,
    List<Pattern> params,
    Node body                    // BlockStatement or Expression
) implements Expression {
    @Override
    public String type() {
        return "ArrowFunctionExpression";
    }
}
