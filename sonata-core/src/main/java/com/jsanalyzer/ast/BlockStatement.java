package com.jsanalyzer.ast;

import java.util.List;

public record BlockStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Statement> body
) implements Statement {
    public BlockStatement(List<Statement> body) {
        this(0, 0, 0, 0, 0, 0, body);
    }

    @Override
    public String type() {
        return "BlockStatement";
    }
}
