package com.jsanalyzer;

public enum TokenType {
    // Literals and names
    IDENTIFIER,
    NUMBER,
    STRING,
    TEMPLATE_LITERAL,   // `text` without substitutions
    TEMPLATE_HEAD,      // `text${
    TEMPLATE_MIDDLE,    // }text${
    TEMPLATE_TAIL,      // }text`

    // Keywords
    VAR(true),
    LET(true),
    CONST(true),
    FUNCTION(true),
    CLASS(true),
    EXTENDS(true),
    RETURN(true),
    IF(true),
    ELSE(true),
    NEW(true),
    THIS(true),
    SUPER(true),
    TYPEOF(true),
    VOID(true),
    DELETE(true),
    IN(true),
    INSTANCEOF(true),
    TRUE(true),
    FALSE(true),
    NULL(true),

    // Delimiters
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    SEMICOLON,
    COMMA,
    DOT,
    ELLIPSIS,
    QUESTION,
    QUESTION_DOT,
    COLON,
    ARROW,

    // Assignment
    ASSIGN,
    PLUS_ASSIGN,
    MINUS_ASSIGN,
    STAR_ASSIGN,
    STAR_STAR_ASSIGN,
    SLASH_ASSIGN,
    PERCENT_ASSIGN,
    LEFT_SHIFT_ASSIGN,
    RIGHT_SHIFT_ASSIGN,
    UNSIGNED_RIGHT_SHIFT_ASSIGN,
    BIT_AND_ASSIGN,
    BIT_OR_ASSIGN,
    BIT_XOR_ASSIGN,
    AND_ASSIGN,
    OR_ASSIGN,
    NULLISH_ASSIGN,

    // Operators
    PLUS,
    MINUS,
    STAR,
    STAR_STAR,
    SLASH,
    PERCENT,
    INCREMENT,
    DECREMENT,
    EQ,
    NE,
    STRICT_EQ,
    STRICT_NE,
    LT,
    LE,
    GT,
    GE,
    LEFT_SHIFT,
    RIGHT_SHIFT,
    UNSIGNED_RIGHT_SHIFT,
    BIT_AND,
    BIT_OR,
    BIT_XOR,
    TILDE,
    BANG,
    AND,
    OR,
    NULLISH,

    EOF;

    private final boolean keyword;

    TokenType() {
        this(false);
    }

    TokenType(boolean keyword) {
        this.keyword = keyword;
    }

    public boolean isKeyword() {
        return keyword;
    }

    public boolean isAssignment() {
        return switch (this) {
            case ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, STAR_STAR_ASSIGN, SLASH_ASSIGN,
                 PERCENT_ASSIGN, LEFT_SHIFT_ASSIGN, RIGHT_SHIFT_ASSIGN, UNSIGNED_RIGHT_SHIFT_ASSIGN,
                 BIT_AND_ASSIGN, BIT_OR_ASSIGN, BIT_XOR_ASSIGN, AND_ASSIGN, OR_ASSIGN, NULLISH_ASSIGN -> true;
            default -> false;
        };
    }
}
