package com.jsanalyzer.ast;

public record ClassExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier id,               // Class name (can be null for anonymous class)
    Expression superClass,       // Can be null if no extends
    ClassBody body
) implements Expression {
    public ClassExpression(Identifier id, Expression superClass, ClassBody body) {
        this(0, 0, 0, 0, 0, 0, id, superClass, body);
    }

    @Override
    public String type() {
        return "ClassExpression";
    }
}
