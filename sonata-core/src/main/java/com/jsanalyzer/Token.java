package com.jsanalyzer;

/**
 * A lexical token.
 *
 * @param literal the cooked value for NUMBER (Double), STRING and template tokens (String), otherwise null
 * @param position start offset in the source
 * @param endPosition end offset (exclusive)
 */
public record Token(
    TokenType type,
    String lexeme,
    Object literal,
    int line,
    int column,
    int position,
    int endPosition,
    int endLine,
    int endColumn
) {
    @Override
    public String toString() {
        return type + " '" + lexeme + "' at " + line + ":" + column;
    }
}
