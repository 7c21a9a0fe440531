package com.jsanalyzer.ast;

import java.util.List;

public record ClassBody(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<MethodDefinition> body
) implements Node {
    public ClassBody(List<MethodDefinition> body) {
        this(0, 0, 0, 0, 0, 0, body);
    }

    @Override
    public String type() {
        return "ClassBody";
    }
}
