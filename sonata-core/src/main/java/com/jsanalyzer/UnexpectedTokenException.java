package com.jsanalyzer;

public class UnexpectedTokenException extends ParseException {
    public UnexpectedTokenException(Token token, String context) {
        super("Unexpected token '" + token.lexeme() + "' in " + context, token);
    }
}
