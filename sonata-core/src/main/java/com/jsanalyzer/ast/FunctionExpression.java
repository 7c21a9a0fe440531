package com.jsanalyzer.ast;

import java.util.List;

public record FunctionExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier id,               // Can be null for anonymous functions
    boolean generator,
    boolean async,
    List<Pattern> params,
    BlockStatement body
) implements Expression {
    @Override
    public String type() {
        return "FunctionExpression";
    }
}
