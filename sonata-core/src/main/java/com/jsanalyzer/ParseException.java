package com.jsanalyzer;

/**
 * Thrown when source text cannot be tokenized or parsed.
 */
public class ParseException extends RuntimeException {
    private final int line;
    private final int column;

    public ParseException(String message, int line, int column) {
        super(message + " (" + line + ":" + column + ")");
        this.line = line;
        this.column = column;
    }

    public ParseException(String message, Token token) {
        this(message, token.line(), token.column());
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
