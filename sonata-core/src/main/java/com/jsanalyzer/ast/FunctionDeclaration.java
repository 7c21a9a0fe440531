package com.jsanalyzer.ast;

import java.util.List;

public record FunctionDeclaration(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier id,
    boolean generator,
    boolean async,
    List<Pattern> params,
    BlockStatement body
) implements Statement {
    @Override
    public String type() {
        return "FunctionDeclaration";
    }
}
