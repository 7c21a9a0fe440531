package com.jsanalyzer.ast;

import java.util.List;

public record Program(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Statement> body,
    String sourceType
) implements Node {
    public Program(List<Statement> body, String sourceType) {
        this(0, 0, 0, 0, 0, 0, body, sourceType);
    }

    @Override
    public String type() {
        return "Program";
    }
}
