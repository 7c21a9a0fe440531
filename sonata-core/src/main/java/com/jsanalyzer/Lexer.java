package com.jsanalyzer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Tokenizer for the supported JavaScript subset.
 *
 * <p>Regular expression literals are not recognized: a {@code /} is always the division
 * operator. Template literals are split into HEAD/MIDDLE/TAIL tokens so the parser can
 * parse substitutions as ordinary expressions.</p>
 */
public class Lexer {
    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("var", TokenType.VAR),
        Map.entry("let", TokenType.LET),
        Map.entry("const", TokenType.CONST),
        Map.entry("function", TokenType.FUNCTION),
        Map.entry("class", TokenType.CLASS),
        Map.entry("extends", TokenType.EXTENDS),
        Map.entry("return", TokenType.RETURN),
        Map.entry("if", TokenType.IF),
        Map.entry("else", TokenType.ELSE),
        Map.entry("new", TokenType.NEW),
        Map.entry("this", TokenType.THIS),
        Map.entry("super", TokenType.SUPER),
        Map.entry("typeof", TokenType.TYPEOF),
        Map.entry("void", TokenType.VOID),
        Map.entry("delete", TokenType.DELETE),
        Map.entry("in", TokenType.IN),
        Map.entry("instanceof", TokenType.INSTANCEOF),
        Map.entry("true", TokenType.TRUE),
        Map.entry("false", TokenType.FALSE),
        Map.entry("null", TokenType.NULL)
    );

    private final String source;
    private final int length;
    private final List<Token> tokens = new ArrayList<>();

    // Brace depth at which each open template substitution started
    private final Deque<Integer> templateStack = new ArrayDeque<>();
    private int braceDepth = 0;

    private int position = 0;
    private int line = 1;
    private int column = 0;

    private int tokenStart;
    private int tokenLine;
    private int tokenColumn;

    public Lexer(String source) {
        this.source = source;
        this.length = source.length();
    }

    public List<Token> tokenize() {
        while (true) {
            skipWhitespaceAndComments();
            tokenStart = position;
            tokenLine = line;
            tokenColumn = column;
            if (position >= length) {
                tokens.add(new Token(TokenType.EOF, "", null, line, column, position, position, line, column));
                return tokens;
            }
            scanToken();
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> add(TokenType.LPAREN);
            case ')' -> add(TokenType.RPAREN);
            case '[' -> add(TokenType.LBRACKET);
            case ']' -> add(TokenType.RBRACKET);
            case ';' -> add(TokenType.SEMICOLON);
            case ',' -> add(TokenType.COMMA);
            case ':' -> add(TokenType.COLON);
            case '~' -> add(TokenType.TILDE);
            case '{' -> {
                braceDepth++;
                add(TokenType.LBRACE);
            }
            case '}' -> {
                if (!templateStack.isEmpty() && templateStack.peek() == braceDepth) {
                    templateStack.pop();
                    scanTemplateContinuation();
                } else {
                    braceDepth--;
                    add(TokenType.RBRACE);
                }
            }
            case '`' -> scanTemplate(true);
            case '"', '\'' -> scanString(c);
            case '.' -> {
                if (isDigit(peek())) {
                    scanNumber();
                } else if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    add(TokenType.ELLIPSIS);
                } else {
                    add(TokenType.DOT);
                }
            }
            case '?' -> {
                if (peek() == '?') {
                    advance();
                    add(match('=') ? TokenType.NULLISH_ASSIGN : TokenType.NULLISH);
                } else if (peek() == '.' && !isDigit(peekNext())) {
                    advance();
                    add(TokenType.QUESTION_DOT);
                } else {
                    add(TokenType.QUESTION);
                }
            }
            case '=' -> {
                if (match('>')) {
                    add(TokenType.ARROW);
                } else if (match('=')) {
                    add(match('=') ? TokenType.STRICT_EQ : TokenType.EQ);
                } else {
                    add(TokenType.ASSIGN);
                }
            }
            case '!' -> {
                if (match('=')) {
                    add(match('=') ? TokenType.STRICT_NE : TokenType.NE);
                } else {
                    add(TokenType.BANG);
                }
            }
            case '+' -> add(match('+') ? TokenType.INCREMENT : match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
            case '-' -> add(match('-') ? TokenType.DECREMENT : match('=') ? TokenType.MINUS_ASSIGN : TokenType.MINUS);
            case '*' -> {
                if (match('*')) {
                    add(match('=') ? TokenType.STAR_STAR_ASSIGN : TokenType.STAR_STAR);
                } else {
                    add(match('=') ? TokenType.STAR_ASSIGN : TokenType.STAR);
                }
            }
            case '/' -> add(match('=') ? TokenType.SLASH_ASSIGN : TokenType.SLASH);
            case '%' -> add(match('=') ? TokenType.PERCENT_ASSIGN : TokenType.PERCENT);
            case '<' -> {
                if (match('<')) {
                    add(match('=') ? TokenType.LEFT_SHIFT_ASSIGN : TokenType.LEFT_SHIFT);
                } else {
                    add(match('=') ? TokenType.LE : TokenType.LT);
                }
            }
            case '>' -> {
                if (match('>')) {
                    if (match('>')) {
                        add(match('=') ? TokenType.UNSIGNED_RIGHT_SHIFT_ASSIGN : TokenType.UNSIGNED_RIGHT_SHIFT);
                    } else {
                        add(match('=') ? TokenType.RIGHT_SHIFT_ASSIGN : TokenType.RIGHT_SHIFT);
                    }
                } else {
                    add(match('=') ? TokenType.GE : TokenType.GT);
                }
            }
            case '&' -> {
                if (match('&')) {
                    add(match('=') ? TokenType.AND_ASSIGN : TokenType.AND);
                } else {
                    add(match('=') ? TokenType.BIT_AND_ASSIGN : TokenType.BIT_AND);
                }
            }
            case '|' -> {
                if (match('|')) {
                    add(match('=') ? TokenType.OR_ASSIGN : TokenType.OR);
                } else {
                    add(match('=') ? TokenType.BIT_OR_ASSIGN : TokenType.BIT_OR);
                }
            }
            case '^' -> add(match('=') ? TokenType.BIT_XOR_ASSIGN : TokenType.BIT_XOR);
            default -> {
                if (isDigit(c)) {
                    scanNumber();
                } else if (isIdentifierStart(c)) {
                    scanIdentifier();
                } else {
                    throw new ParseException("Unexpected character '" + c + "'", tokenLine, tokenColumn);
                }
            }
        }
    }

    private void scanIdentifier() {
        while (position < length && isIdentifierPart(peek())) {
            advance();
        }
        String text = source.substring(tokenStart, position);
        add(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    // Called with the first character already consumed
    private void scanNumber() {
        char first = source.charAt(tokenStart);
        if (first == '0' && (peek() == 'x' || peek() == 'X' || peek() == 'o' || peek() == 'O'
                || peek() == 'b' || peek() == 'B')) {
            char prefix = Character.toLowerCase(advance());
            int radix = prefix == 'x' ? 16 : prefix == 'o' ? 8 : 2;
            int digitsStart = position;
            while (position < length && (Character.digit(peek(), radix) >= 0 || peek() == '_')) {
                advance();
            }
            String digits = source.substring(digitsStart, position).replace("_", "");
            if (digits.isEmpty()) {
                throw new ParseException("Invalid number literal", tokenLine, tokenColumn);
            }
            addLiteral(TokenType.NUMBER, new java.math.BigInteger(digits, radix).doubleValue());
            return;
        }

        if (first != '.') {
            consumeDigits();
            if (peek() == '.') {
                advance();
                consumeDigits();
            }
        } else {
            consumeDigits();
        }
        if (peek() == 'e' || peek() == 'E') {
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            if (!isDigit(peek())) {
                throw new ParseException("Invalid exponent in number literal", tokenLine, tokenColumn);
            }
            consumeDigits();
        }
        if (position < length && isIdentifierStart(peek())) {
            throw new ParseException("Identifier starts immediately after numeric literal", line, column);
        }
        String text = source.substring(tokenStart, position).replace("_", "");
        addLiteral(TokenType.NUMBER, Double.parseDouble(text));
    }

    private void consumeDigits() {
        while (position < length && (isDigit(peek()) || peek() == '_')) {
            advance();
        }
    }

    private void scanString(char quote) {
        StringBuilder value = new StringBuilder();
        while (true) {
            if (position >= length || peek() == '\n' || peek() == '\r') {
                throw new ParseException("Unterminated string literal", tokenLine, tokenColumn);
            }
            char c = advance();
            if (c == quote) {
                break;
            }
            if (c == '\\') {
                readEscape(value);
            } else {
                value.append(c);
            }
        }
        addLiteral(TokenType.STRING, value.toString());
    }

    private void scanTemplate(boolean head) {
        StringBuilder cooked = new StringBuilder();
        while (true) {
            if (position >= length) {
                throw new ParseException("Unterminated template literal", tokenLine, tokenColumn);
            }
            char c = advance();
            if (c == '`') {
                addLiteral(head ? TokenType.TEMPLATE_LITERAL : TokenType.TEMPLATE_TAIL, cooked.toString());
                return;
            }
            if (c == '$' && peek() == '{') {
                advance();
                templateStack.push(braceDepth);
                addLiteral(head ? TokenType.TEMPLATE_HEAD : TokenType.TEMPLATE_MIDDLE, cooked.toString());
                return;
            }
            if (c == '\\') {
                readEscape(cooked);
            } else {
                cooked.append(c);
            }
        }
    }

    private void scanTemplateContinuation() {
        scanTemplate(false);
    }

    private void readEscape(StringBuilder out) {
        if (position >= length) {
            throw new ParseException("Unterminated escape sequence", line, column);
        }
        char c = advance();
        switch (c) {
            case 'n' -> out.append('\n');
            case 't' -> out.append('\t');
            case 'r' -> out.append('\r');
            case 'b' -> out.append('\b');
            case 'f' -> out.append('\f');
            case 'v' -> out.append('\u000B');
            case '0' -> out.append('\0');
            case 'x' -> out.append((char) readHex(2));
            case 'u' -> {
                if (match('{')) {
                    int start = position;
                    while (position < length && peek() != '}') {
                        advance();
                    }
                    if (!match('}')) {
                        throw new ParseException("Unterminated unicode escape", line, column);
                    }
                    out.appendCodePoint(Integer.parseInt(source.substring(start, position - 1), 16));
                } else {
                    out.append((char) readHex(4));
                }
            }
            case '\r' -> match('\n'); // line continuation
            case '\n', '\u2028', '\u2029' -> {
                // line continuation
            }
            default -> out.append(c);
        }
    }

    private int readHex(int digits) {
        if (position + digits > length) {
            throw new ParseException("Invalid hexadecimal escape", line, column);
        }
        String hex = source.substring(position, position + digits);
        for (int i = 0; i < digits; i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                throw new ParseException("Invalid hexadecimal escape", line, column);
            }
            advance();
        }
        return Integer.parseInt(hex, 16);
    }

    private void skipWhitespaceAndComments() {
        while (position < length) {
            char c = peek();
            if (c == '/' && peekNext() == '/') {
                while (position < length && peek() != '\n' && peek() != '\r') {
                    advance();
                }
            } else if (c == '/' && peekNext() == '*') {
                int startLine = line;
                int startColumn = column;
                advance();
                advance();
                while (!(peek() == '*' && peekNext() == '/')) {
                    if (position >= length) {
                        throw new ParseException("Unterminated comment", startLine, startColumn);
                    }
                    advance();
                }
                advance();
                advance();
            } else if (Character.isWhitespace(c) || c == '\u00A0' || c == '\uFEFF') {
                advance();
            } else {
                return;
            }
        }
    }

    private void add(TokenType type) {
        addLiteral(type, null);
    }

    private void addLiteral(TokenType type, Object literal) {
        String lexeme = source.substring(tokenStart, position);
        tokens.add(new Token(type, lexeme, literal, tokenLine, tokenColumn, tokenStart, position, line, column));
        // A template continuation starts right after the closing brace it consumed
        tokenStart = position;
        tokenLine = line;
        tokenColumn = column;
    }

    private char advance() {
        char c = source.charAt(position++);
        if (c == '\n' || c == '\u2028' || c == '\u2029' || (c == '\r' && peek() != '\n')) {
            line++;
            column = 0;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (position < length && source.charAt(position) == expected) {
            advance();
            return true;
        }
        return false;
    }

    private char peek() {
        return position < length ? source.charAt(position) : '\0';
    }

    private char peekNext() {
        return position + 1 < length ? source.charAt(position + 1) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '$' || c == '_' || Character.isUnicodeIdentifierStart(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '$' || c == '_' || c == '\u200C' || c == '\u200D' || Character.isUnicodeIdentifierPart(c);
    }
}
