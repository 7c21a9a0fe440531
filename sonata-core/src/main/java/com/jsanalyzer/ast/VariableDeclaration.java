package com.jsanalyzer.ast;

import java.util.List;

public record VariableDeclaration(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<VariableDeclarator> declarations,
    String kind                  // "var" | "let" | "const"
) implements Statement {
    public VariableDeclaration(List<VariableDeclarator> declarations, String kind) {
        this(0, 0, 0, 0, 0, 0, declarations, kind);
    }

    @Override
    public String type() {
        return "VariableDeclaration";
    }
}
