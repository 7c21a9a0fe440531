package com.jsanalyzer.ast;

public record ClassDeclaration(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier id,               // Class name
    Expression superClass,       // Can be null if no extends
    ClassBody body
) implements Statement {
    public ClassDeclaration(Identifier id, Expression superClass, ClassBody body) {
        this(0, 0, 0, 0, 0, 0, id, superClass, body);
    }

    @Override
    public String type() {
        return "ClassDeclaration";
    }
}
