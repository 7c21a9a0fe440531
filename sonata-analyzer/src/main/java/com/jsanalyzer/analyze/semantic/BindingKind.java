package com.jsanalyzer.analyze.semantic;

public enum BindingKind {
    VAR,
    LET,
    CONST,
    FUNCTION,
    CLASS,
    PARAMETER;

    static BindingKind ofDeclarationKind(String kind) {
        return switch (kind) {
            case "var" -> VAR;
            case "let" -> LET;
            case "const" -> CONST;
            default -> throw new IllegalArgumentException("Unknown declaration kind: " + kind);
        };
    }

    public boolean isBlockScoped() {
        return this == LET || this == CONST || this == CLASS;
    }
}
