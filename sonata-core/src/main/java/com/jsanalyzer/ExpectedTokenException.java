package com.jsanalyzer;

public class ExpectedTokenException extends ParseException {
    public ExpectedTokenException(String expected, Token found) {
        super("Expected " + expected + " but found " + describe(found), found);
    }

    private static String describe(Token token) {
        return token.type() == TokenType.EOF ? "end of input" : "'" + token.lexeme() + "'";
    }
}
