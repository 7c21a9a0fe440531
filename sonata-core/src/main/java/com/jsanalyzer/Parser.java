package com.jsanalyzer;

import com.jsanalyzer.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Pratt parser for the JavaScript subset analyzed by Sonata.
 *
 * <p>Parentheses are preserved as {@link ParenthesizedExpression} nodes so that rewrites can
 * reason about the grouping the author wrote. Destructuring patterns, loops, switch, try,
 * labels, modules and regular expression literals are not supported.</p>
 */
public class Parser {
    // ========================================================================
    // Binding Power Constants for Pratt Parser
    // ========================================================================
    // Higher binding power = tighter binding (higher precedence)
    private static final int BP_NONE = 0;           // Lowest - used as minimum for top-level
    private static final int BP_COMMA = 1;          // Comma/Sequence operator
    private static final int BP_ASSIGNMENT = 2;     // Assignment (=, +=, etc.) - right-associative
    private static final int BP_TERNARY = 3;        // Conditional (? :)
    private static final int BP_NULLISH = 4;        // Nullish coalescing (??)
    private static final int BP_OR = 5;             // Logical OR (||)
    private static final int BP_AND = 6;            // Logical AND (&&)
    private static final int BP_BIT_OR = 7;         // Bitwise OR (|)
    private static final int BP_BIT_XOR = 8;        // Bitwise XOR (^)
    private static final int BP_BIT_AND = 9;        // Bitwise AND (&)
    private static final int BP_EQUALITY = 10;      // Equality (==, !=, ===, !==)
    private static final int BP_RELATIONAL = 11;    // Relational (<, <=, >, >=, instanceof, in)
    private static final int BP_SHIFT = 12;         // Shift (<<, >>, >>>)
    private static final int BP_ADDITIVE = 13;      // Additive (+, -)
    private static final int BP_MULTIPLICATIVE = 14;// Multiplicative (*, /, %)
    private static final int BP_EXPONENT = 15;      // Exponentiation (**) - right-associative
    private static final int BP_UNARY = 16;         // Prefix unary (!, -, +, ~, typeof, void, delete, await)
    private static final int BP_POSTFIX = 17;       // Postfix (x++, x--, call, member access, optional chaining)

    private final List<Token> tokens;
    private final String source;
    private final boolean forceModuleMode;
    private int current = 0;

    private boolean inAsyncContext = false;
    private boolean inGenerator = false;
    private int functionDepth = 0;

    public Parser(String source) {
        this(source, false);
    }

    public Parser(String source, boolean forceModuleMode) {
        this.source = source;
        this.forceModuleMode = forceModuleMode;
        this.tokens = new Lexer(source).tokenize();
    }

    public static Program parse(String source) {
        return new Parser(source).parse();
    }

    public static Program parse(String source, boolean forceModuleMode) {
        return new Parser(source, forceModuleMode).parse();
    }

    public Program parse() {
        List<Statement> statements = new ArrayList<>();
        while (!isAtEnd()) {
            statements.add(parseStatement());
        }
        Token eof = peek();
        String sourceType = forceModuleMode ? "module" : "script";
        return new Program(0, source.length(), 1, 0, eof.line(), eof.column(), statements, sourceType);
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private Statement parseStatement() {
        Token token = peek();
        return switch (token.type()) {
            case VAR, LET, CONST -> {
                VariableDeclaration declaration = parseVariableDeclaration();
                consumeSemicolon();
                yield withEnd(declaration, previous());
            }
            case FUNCTION -> parseFunctionDeclaration(token, false);
            case CLASS -> parseClassDeclaration();
            case RETURN -> parseReturnStatement();
            case IF -> parseIfStatement();
            case LBRACE -> parseBlock();
            case SEMICOLON -> {
                advance();
                yield new EmptyStatement(token.position(), token.endPosition(), token.line(), token.column(),
                    token.endLine(), token.endColumn());
            }
            case IDENTIFIER -> {
                if (isAsyncFunctionStart()) {
                    advance();
                    yield parseFunctionDeclaration(token, true);
                }
                yield parseExpressionStatement();
            }
            default -> parseExpressionStatement();
        };
    }

    private Statement parseExpressionStatement() {
        Token start = peek();
        Expression expression = parseExpression();
        consumeSemicolon();
        Token end = previous();
        return new ExpressionStatement(start.position(), end.endPosition(), start.line(), start.column(),
            end.endLine(), end.endColumn(), expression);
    }

    private VariableDeclaration parseVariableDeclaration() {
        Token kindToken = advance();
        List<VariableDeclarator> declarators = new ArrayList<>();
        do {
            Token idToken = peek();
            if (idToken.type() != TokenType.IDENTIFIER) {
                throw new ExpectedTokenException("variable name", idToken);
            }
            advance();
            Identifier id = identifier(idToken);
            Expression init = null;
            if (match(TokenType.ASSIGN)) {
                init = parseExpr(BP_ASSIGNMENT);
            } else if (kindToken.type() == TokenType.CONST) {
                throw new ExpectedTokenException("initializer in const declaration", peek());
            }
            Token end = previous();
            declarators.add(new VariableDeclarator(idToken.position(), end.endPosition(), idToken.line(),
                idToken.column(), end.endLine(), end.endColumn(), id, init));
        } while (match(TokenType.COMMA));
        Token end = previous();
        return new VariableDeclaration(kindToken.position(), end.endPosition(), kindToken.line(), kindToken.column(),
            end.endLine(), end.endColumn(), declarators, kindToken.lexeme());
    }

    private VariableDeclaration withEnd(VariableDeclaration declaration, Token end) {
        return new VariableDeclaration(declaration.start(), end.endPosition(), declaration.startLine(),
            declaration.startCol(), end.endLine(), end.endColumn(), declaration.declarations(), declaration.kind());
    }

    private Statement parseReturnStatement() {
        Token start = advance();
        if (functionDepth == 0) {
            throw new ParseException("'return' statement not allowed outside of a function", start);
        }
        Expression argument = null;
        if (!check(TokenType.SEMICOLON) && !check(TokenType.RBRACE) && !isAtEnd()
                && peek().line() == start.endLine()) {
            argument = parseExpression();
        }
        consumeSemicolon();
        Token end = previous();
        return new ReturnStatement(start.position(), end.endPosition(), start.line(), start.column(),
            end.endLine(), end.endColumn(), argument);
    }

    private Statement parseIfStatement() {
        Token start = advance();
        consume(TokenType.LPAREN, "'(' after 'if'");
        Expression test = parseExpression();
        consume(TokenType.RPAREN, "')' after if condition");
        Statement consequent = parseStatement();
        Statement alternate = null;
        if (match(TokenType.ELSE)) {
            alternate = parseStatement();
        }
        Token end = previous();
        return new IfStatement(start.position(), end.endPosition(), start.line(), start.column(),
            end.endLine(), end.endColumn(), test, consequent, alternate);
    }

    private BlockStatement parseBlock() {
        Token start = peek();
        consume(TokenType.LBRACE, "'{'");
        List<Statement> body = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw new ExpectedTokenException("'}'", peek());
            }
            body.add(parseStatement());
        }
        Token end = advance();
        return new BlockStatement(start.position(), end.endPosition(), start.line(), start.column(),
            end.endLine(), end.endColumn(), body);
    }

    private void consumeSemicolon() {
        if (match(TokenType.SEMICOLON)) {
            return;
        }
        // Automatic semicolon insertion
        if (check(TokenType.RBRACE) || isAtEnd() || previous().endLine() < peek().line()) {
            return;
        }
        throw new ExpectedTokenException("';'", peek());
    }

    // ========================================================================
    // Functions and classes
    // ========================================================================

    private FunctionDeclaration parseFunctionDeclaration(Token start, boolean async) {
        consume(TokenType.FUNCTION, "'function'");
        boolean generator = match(TokenType.STAR);
        Token nameToken = peek();
        if (nameToken.type() != TokenType.IDENTIFIER) {
            throw new ExpectedTokenException("function name", nameToken);
        }
        advance();
        List<Pattern> params = parseParameters();
        BlockStatement body = parseFunctionBody(async, generator);
        Token end = previous();
        return new FunctionDeclaration(start.position(), end.endPosition(), start.line(), start.column(),
            end.endLine(), end.endColumn(), identifier(nameToken), generator, async, params, body);
    }

    private FunctionExpression parseFunctionExpression(Token start, boolean async) {
        consume(TokenType.FUNCTION, "'function'");
        boolean generator = match(TokenType.STAR);
        Identifier id = null;
        if (check(TokenType.IDENTIFIER)) {
            id = identifier(advance());
        }
        List<Pattern> params = parseParameters();
        BlockStatement body = parseFunctionBody(async, generator);
        Token end = previous();
        return new FunctionExpression(start.position(), end.endPosition(), start.line(), start.column(),
            end.endLine(), end.endColumn(), id, generator, async, params, body);
    }

    private List<Pattern> parseParameters() {
        consume(TokenType.LPAREN, "'(' before parameters");
        List<Pattern> params = new ArrayList<>();
        while (!check(TokenType.RPAREN)) {
            Token param = peek();
            if (param.type() != TokenType.IDENTIFIER) {
                throw new ExpectedTokenException("parameter name", param);
            }
            params.add(identifier(advance()));
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RPAREN, "')' after parameters");
        return params;
    }

    private BlockStatement parseFunctionBody(boolean async, boolean generator) {
        boolean savedAsync = inAsyncContext;
        boolean savedGenerator = inGenerator;
        inAsyncContext = async;
        inGenerator = generator;
        functionDepth++;
        try {
            return parseBlock();
        } finally {
            functionDepth--;
            inAsyncContext = savedAsync;
            inGenerator = savedGenerator;
        }
    }

    private ClassDeclaration parseClassDeclaration() {
        Token start = advance();
        Token nameToken = peek();
        if (nameToken.type() != TokenType.IDENTIFIER) {
            throw new ExpectedTokenException("class name", nameToken);
        }
        advance();
        Expression superClass = parseClassHeritage();
        ClassBody body = parseClassBody();
        Token end = previous();
        return new ClassDeclaration(start.position(), end.endPosition(), start.line(), start.column(),
            end.endLine(), end.endColumn(), identifier(nameToken), superClass, body);
    }

    private ClassExpression parseClassExpression(Token start) {
        Identifier id = null;
        if (check(TokenType.IDENTIFIER)) {
            id = identifier(advance());
        }
        Expression superClass = parseClassHeritage();
        ClassBody body = parseClassBody();
        Token end = previous();
        return new ClassExpression(start.position(), end.endPosition(), start.line(), start.column(),
            end.endLine(), end.endColumn(), id, superClass, body);
    }

    // ClassHeritage only admits a LeftHandSideExpression
    private Expression parseClassHeritage() {
        if (!match(TokenType.EXTENDS)) {
            return null;
        }
        return parseExpr(BP_POSTFIX);
    }

    private ClassBody parseClassBody() {
        Token start = peek();
        consume(TokenType.LBRACE, "'{' before class body");
        List<MethodDefinition> methods = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw new ExpectedTokenException("'}' after class body", peek());
            }
            if (match(TokenType.SEMICOLON)) {
                continue;
            }
            methods.add(parseMethodDefinition());
        }
        Token end = advance();
        return new ClassBody(start.position(), end.endPosition(), start.line(), start.column(),
            end.endLine(), end.endColumn(), methods);
    }

    private MethodDefinition parseMethodDefinition() {
        Token start = peek();
        boolean isStatic = false;
        if (start.type() == TokenType.IDENTIFIER && start.lexeme().equals("static")
                && !checkAhead(1, TokenType.LPAREN)) {
            advance();
            isStatic = true;
        }
        boolean async = false;
        if (check(TokenType.IDENTIFIER) && peek().lexeme().equals("async") && !checkAhead(1, TokenType.LPAREN)) {
            advance();
            async = true;
        }
        boolean generator = match(TokenType.STAR);

        boolean computed = false;
        Expression key;
        if (match(TokenType.LBRACKET)) {
            computed = true;
            key = parseExpr(BP_ASSIGNMENT);
            consume(TokenType.RBRACKET, "']' after computed method name");
        } else {
            key = parsePropertyName();
        }

        Token paramsStart = peek();
        List<Pattern> params = parseParameters();
        BlockStatement body = parseFunctionBody(async, generator);
        Token end = previous();
        FunctionExpression value = new FunctionExpression(paramsStart.position(), end.endPosition(),
            paramsStart.line(), paramsStart.column(), end.endLine(), end.endColumn(), null, generator, async, params, body);

        String kind = !isStatic && !computed && key instanceof Identifier id && id.name().equals("constructor")
            ? "constructor"
            : "method";
        return new MethodDefinition(start.position(), end.endPosition(), start.line(), start.column(),
            end.endLine(), end.endColumn(), key, value, kind, computed, isStatic);
    }

    private Expression parsePropertyName() {
        Token token = peek();
        if (isIdentifierName(token)) {
            advance();
            return identifier(token);
        }
        if (token.type() == TokenType.STRING || token.type() == TokenType.NUMBER) {
            advance();
            return literal(token, token.literal());
        }
        throw new ExpectedTokenException("property name", token);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private Expression parseExpression() {
        return parseExpr(BP_COMMA);
    }

    // ========================================================================
    // Unified Pratt Parser - parseExpr(int minBp)
    // ========================================================================
    // Parses expressions with binding power >= minBp:
    // 1. Parse a prefix expression (NUD)
    // 2. While the next token has binding power >= minBp, parse infix (LED)

    private Expression parseExpr(int minBp) {
        Token startToken = peek();
        Expression left = null;

        if (startToken.type() == TokenType.IDENTIFIER) {
            String lexeme = startToken.lexeme();
            if (checkAhead(1, TokenType.ARROW)) {
                left = parseArrowFunction(startToken, false);
            } else if (lexeme.equals("async") && isAsyncArrowStart()) {
                advance();
                left = parseArrowFunction(startToken, true);
            } else if (lexeme.equals("await") && isAwaitAllowed()) {
                advance();
                Expression argument = parseExpr(BP_UNARY);
                left = new AwaitExpression(startToken.position(), argument.end(), startToken.line(),
                    startToken.column(), argument.endLine(), argument.endCol(), argument);
            } else if (lexeme.equals("yield") && inGenerator && minBp <= BP_ASSIGNMENT) {
                left = parseYieldExpression();
            }
        } else if (startToken.type() == TokenType.LPAREN && isArrowParameters(current)) {
            left = parseArrowFunction(startToken, false);
        }

        if (left == null) {
            left = parsePrefix(advance());
        }

        // Infix/Postfix loop
        while (true) {
            Token token = peek();
            TokenType tt = token.type();

            // Member access, calls and tagged templates bind tighter than everything else
            if (tt == TokenType.DOT || tt == TokenType.QUESTION_DOT || tt == TokenType.LBRACKET
                    || tt == TokenType.LPAREN || tt == TokenType.TEMPLATE_LITERAL || tt == TokenType.TEMPLATE_HEAD) {
                if (left instanceof ArrowFunctionExpression) {
                    break;
                }
                left = parseCallOrMember(left);
                continue;
            }

            // Postfix ++/-- with line terminator restriction
            if (tt == TokenType.INCREMENT || tt == TokenType.DECREMENT) {
                if (previous().endLine() < token.line() || BP_POSTFIX < minBp) {
                    break;
                }
                validateSimpleAssignmentTarget(left, token);
                advance();
                left = new UpdateExpression(left.start(), token.endPosition(), left.startLine(), left.startCol(),
                    token.endLine(), token.endColumn(), token.lexeme(), false, left);
                continue;
            }

            int lbp = switch (tt) {
                case COMMA -> BP_COMMA;
                case ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, STAR_STAR_ASSIGN, SLASH_ASSIGN,
                     PERCENT_ASSIGN, LEFT_SHIFT_ASSIGN, RIGHT_SHIFT_ASSIGN, UNSIGNED_RIGHT_SHIFT_ASSIGN,
                     BIT_AND_ASSIGN, BIT_OR_ASSIGN, BIT_XOR_ASSIGN, AND_ASSIGN, OR_ASSIGN, NULLISH_ASSIGN -> BP_ASSIGNMENT;
                case QUESTION -> BP_TERNARY;
                case NULLISH -> BP_NULLISH;
                case OR -> BP_OR;
                case AND -> BP_AND;
                case BIT_OR -> BP_BIT_OR;
                case BIT_XOR -> BP_BIT_XOR;
                case BIT_AND -> BP_BIT_AND;
                case EQ, NE, STRICT_EQ, STRICT_NE -> BP_EQUALITY;
                case LT, LE, GT, GE, INSTANCEOF, IN -> BP_RELATIONAL;
                case LEFT_SHIFT, RIGHT_SHIFT, UNSIGNED_RIGHT_SHIFT -> BP_SHIFT;
                case PLUS, MINUS -> BP_ADDITIVE;
                case STAR, SLASH, PERCENT -> BP_MULTIPLICATIVE;
                case STAR_STAR -> BP_EXPONENT;
                default -> BP_NONE;
            };
            if (lbp == BP_NONE || lbp < minBp) {
                break;
            }

            if (tt == TokenType.COMMA) {
                List<Expression> expressions = new ArrayList<>();
                expressions.add(left);
                while (match(TokenType.COMMA)) {
                    expressions.add(parseExpr(BP_ASSIGNMENT));
                }
                Expression last = expressions.get(expressions.size() - 1);
                left = new SequenceExpression(left.start(), last.end(), left.startLine(), left.startCol(),
                    last.endLine(), last.endCol(), expressions);
                continue;
            }

            if (tt.isAssignment()) {
                validateSimpleAssignmentTarget(left, token);
                advance();
                // Right-associative
                Expression right = parseExpr(BP_ASSIGNMENT);
                left = new AssignmentExpression(left.start(), right.end(), left.startLine(), left.startCol(),
                    right.endLine(), right.endCol(), token.lexeme(), left, right);
                continue;
            }

            if (tt == TokenType.QUESTION) {
                advance();
                Expression consequent = parseExpr(BP_ASSIGNMENT);
                consume(TokenType.COLON, "':' in conditional expression");
                Expression alternate = parseExpr(BP_ASSIGNMENT);
                left = new ConditionalExpression(left.start(), alternate.end(), left.startLine(), left.startCol(),
                    alternate.endLine(), alternate.endCol(), left, consequent, alternate);
                continue;
            }

            if (tt == TokenType.STAR_STAR && (left instanceof UnaryExpression || left instanceof AwaitExpression)) {
                throw new ParseException("Unary operator used immediately before exponentiation expression; "
                    + "parentheses must be used to disambiguate operator precedence", token);
            }

            advance();
            // ** is right-associative: the right operand is parsed at the same binding power
            int rightBp = tt == TokenType.STAR_STAR ? BP_EXPONENT : lbp + 1;
            Expression right = parseExpr(rightBp);
            if (tt == TokenType.AND || tt == TokenType.OR || tt == TokenType.NULLISH) {
                left = new LogicalExpression(left.start(), right.end(), left.startLine(), left.startCol(),
                    right.endLine(), right.endCol(), token.lexeme(), left, right);
            } else {
                left = new BinaryExpression(left.start(), right.end(), left.startLine(), left.startCol(),
                    right.endLine(), right.endCol(), token.lexeme(), left, right);
            }
        }

        return left;
    }

    private Expression parsePrefix(Token token) {
        return switch (token.type()) {
            case NUMBER, STRING -> literal(token, token.literal());
            case TRUE -> literal(token, Boolean.TRUE);
            case FALSE -> literal(token, Boolean.FALSE);
            case NULL -> literal(token, null);
            case IDENTIFIER -> {
                if (token.lexeme().equals("async") && check(TokenType.FUNCTION) && peek().line() == token.line()) {
                    yield parseFunctionExpression(token, true);
                }
                yield identifier(token);
            }
            case THIS -> new ThisExpression(token.position(), token.endPosition(), token.line(), token.column(),
                token.endLine(), token.endColumn());
            case SUPER -> new Super(token.position(), token.endPosition(), token.line(), token.column(),
                token.endLine(), token.endColumn());
            case LPAREN -> {
                Expression expression = parseExpression();
                consume(TokenType.RPAREN, "')' after expression");
                Token end = previous();
                yield new ParenthesizedExpression(token.position(), end.endPosition(), token.line(), token.column(),
                    end.endLine(), end.endColumn(), expression);
            }
            case LBRACKET -> parseArrayLiteral(token);
            case LBRACE -> parseObjectLiteral(token);
            case FUNCTION -> {
                current--;
                yield parseFunctionExpression(token, false);
            }
            case CLASS -> parseClassExpression(token);
            case NEW -> parseNewExpression(token);
            case BANG, MINUS, PLUS, TILDE, TYPEOF, VOID, DELETE -> {
                Expression argument = parseExpr(BP_UNARY);
                yield new UnaryExpression(token.position(), argument.end(), token.line(), token.column(),
                    argument.endLine(), argument.endCol(), token.lexeme(), argument);
            }
            case INCREMENT, DECREMENT -> {
                Expression argument = parseExpr(BP_UNARY);
                validateSimpleAssignmentTarget(argument, token);
                yield new UpdateExpression(token.position(), argument.end(), token.line(), token.column(),
                    argument.endLine(), argument.endCol(), token.lexeme(), true, argument);
            }
            case TEMPLATE_LITERAL, TEMPLATE_HEAD -> parseTemplate(token);
            default -> throw new UnexpectedTokenException(token, "expression");
        };
    }

    private Expression parseCallOrMember(Expression left) {
        Token token = advance();
        switch (token.type()) {
            case DOT -> {
                Token name = advance();
                if (!isIdentifierName(name)) {
                    throw new ExpectedTokenException("property name after '.'", name);
                }
                return new MemberExpression(left.start(), name.endPosition(), left.startLine(), left.startCol(),
                    name.endLine(), name.endColumn(), left, identifier(name), false, false);
            }
            case QUESTION_DOT -> {
                if (match(TokenType.LPAREN)) {
                    List<Expression> arguments = parseArgumentsAfterParen();
                    Token end = previous();
                    return new CallExpression(left.start(), end.endPosition(), left.startLine(), left.startCol(),
                        end.endLine(), end.endColumn(), left, arguments, true);
                }
                if (match(TokenType.LBRACKET)) {
                    Expression property = parseExpression();
                    consume(TokenType.RBRACKET, "']' after computed member");
                    Token end = previous();
                    return new MemberExpression(left.start(), end.endPosition(), left.startLine(), left.startCol(),
                        end.endLine(), end.endColumn(), left, property, true, true);
                }
                Token name = advance();
                if (!isIdentifierName(name)) {
                    throw new ExpectedTokenException("property name after '?.'", name);
                }
                return new MemberExpression(left.start(), name.endPosition(), left.startLine(), left.startCol(),
                    name.endLine(), name.endColumn(), left, identifier(name), false, true);
            }
            case LBRACKET -> {
                Expression property = parseExpression();
                consume(TokenType.RBRACKET, "']' after computed member");
                Token end = previous();
                return new MemberExpression(left.start(), end.endPosition(), left.startLine(), left.startCol(),
                    end.endLine(), end.endColumn(), left, property, true, false);
            }
            case LPAREN -> {
                List<Expression> arguments = parseArgumentsAfterParen();
                Token end = previous();
                return new CallExpression(left.start(), end.endPosition(), left.startLine(), left.startCol(),
                    end.endLine(), end.endColumn(), left, arguments, false);
            }
            case TEMPLATE_LITERAL, TEMPLATE_HEAD -> {
                TemplateLiteral quasi = parseTemplate(token);
                return new TaggedTemplateExpression(left.start(), quasi.end(), left.startLine(), left.startCol(),
                    quasi.endLine(), quasi.endCol(), left, quasi);
            }
            default -> throw new UnexpectedTokenException(token, "member access");
        }
    }

    private Expression parseNewExpression(Token newToken) {
        if (match(TokenType.DOT)) {
            Token property = advance();
            if (!property.lexeme().equals("target")) {
                throw new ExpectedTokenException("'target' after 'new.'", property);
            }
            return new MetaProperty(newToken.position(), property.endPosition(), newToken.line(), newToken.column(),
                property.endLine(), property.endColumn(), identifier(newToken), identifier(property));
        }

        Expression callee;
        Token calleeStart = advance();
        if (calleeStart.type() == TokenType.NEW) {
            callee = parseNewExpression(calleeStart);
        } else {
            callee = parsePrefix(calleeStart);
        }
        // Member accesses belong to the callee; the first argument list belongs to 'new'
        while (check(TokenType.DOT) || check(TokenType.LBRACKET)
                || check(TokenType.TEMPLATE_LITERAL) || check(TokenType.TEMPLATE_HEAD)) {
            callee = parseCallOrMember(callee);
        }
        List<Expression> arguments = List.of();
        if (match(TokenType.LPAREN)) {
            arguments = parseArgumentsAfterParen();
        }
        Token end = previous();
        return new NewExpression(newToken.position(), end.endPosition(), newToken.line(), newToken.column(),
            end.endLine(), end.endColumn(), callee, arguments);
    }

    private List<Expression> parseArgumentsAfterParen() {
        List<Expression> arguments = new ArrayList<>();
        while (!check(TokenType.RPAREN)) {
            arguments.add(parseSpreadOrAssignment());
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RPAREN, "')' after arguments");
        return arguments;
    }

    private Expression parseSpreadOrAssignment() {
        if (check(TokenType.ELLIPSIS)) {
            Token start = advance();
            Expression argument = parseExpr(BP_ASSIGNMENT);
            return new SpreadElement(start.position(), argument.end(), start.line(), start.column(),
                argument.endLine(), argument.endCol(), argument);
        }
        return parseExpr(BP_ASSIGNMENT);
    }

    private Expression parseArrayLiteral(Token start) {
        List<Expression> elements = new ArrayList<>();
        while (!check(TokenType.RBRACKET)) {
            elements.add(parseSpreadOrAssignment());
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RBRACKET, "']' after array elements");
        Token end = previous();
        return new ArrayExpression(start.position(), end.endPosition(), start.line(), start.column(),
            end.endLine(), end.endColumn(), elements);
    }

    private Expression parseObjectLiteral(Token start) {
        List<Property> properties = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            Token keyStart = peek();
            boolean computed = false;
            Expression key;
            if (match(TokenType.LBRACKET)) {
                computed = true;
                key = parseExpr(BP_ASSIGNMENT);
                consume(TokenType.RBRACKET, "']' after computed property name");
            } else {
                key = parsePropertyName();
            }

            Expression value;
            boolean shorthand = false;
            if (match(TokenType.COLON)) {
                value = parseExpr(BP_ASSIGNMENT);
            } else if (!computed && keyStart.type() == TokenType.IDENTIFIER) {
                shorthand = true;
                // A distinct instance, so key and value are separate nodes of the tree
                value = identifier(keyStart);
            } else {
                throw new ExpectedTokenException("':' after property name", peek());
            }
            Token end = previous();
            properties.add(new Property(keyStart.position(), end.endPosition(), keyStart.line(), keyStart.column(),
                end.endLine(), end.endColumn(), key, value, computed, shorthand));
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RBRACE, "'}' after object literal");
        Token end = previous();
        return new ObjectExpression(start.position(), end.endPosition(), start.line(), start.column(),
            end.endLine(), end.endColumn(), properties);
    }

    private TemplateLiteral parseTemplate(Token first) {
        List<TemplateElement> quasis = new ArrayList<>();
        List<Expression> expressions = new ArrayList<>();
        quasis.add(templateElement(first));
        Token last = first;
        if (first.type() == TokenType.TEMPLATE_HEAD) {
            while (true) {
                expressions.add(parseExpression());
                Token part = advance();
                if (part.type() != TokenType.TEMPLATE_MIDDLE && part.type() != TokenType.TEMPLATE_TAIL) {
                    throw new ExpectedTokenException("'}' closing template substitution", part);
                }
                quasis.add(templateElement(part));
                last = part;
                if (part.type() == TokenType.TEMPLATE_TAIL) {
                    break;
                }
            }
        }
        return new TemplateLiteral(first.position(), last.endPosition(), first.line(), first.column(),
            last.endLine(), last.endColumn(), quasis, expressions);
    }

    private TemplateElement templateElement(Token token) {
        String lexeme = token.lexeme();
        // Strip the leading '`' or '}' and the trailing '`' or '${'
        boolean tail = token.type() == TokenType.TEMPLATE_LITERAL || token.type() == TokenType.TEMPLATE_TAIL;
        String raw = lexeme.substring(1, lexeme.length() - (tail ? 1 : 2));
        return new TemplateElement(token.position(), token.endPosition(), token.line(), token.column(),
            token.endLine(), token.endColumn(),
            new TemplateElement.TemplateElementValue(raw, (String) token.literal()), tail);
    }

    private Expression parseArrowFunction(Token start, boolean async) {
        List<Pattern> params = new ArrayList<>();
        if (match(TokenType.LPAREN)) {
            while (!check(TokenType.RPAREN)) {
                Token param = peek();
                if (param.type() != TokenType.IDENTIFIER) {
                    throw new ExpectedTokenException("parameter name", param);
                }
                params.add(identifier(advance()));
                if (!match(TokenType.COMMA)) {
                    break;
                }
            }
            consume(TokenType.RPAREN, "')' after arrow parameters");
        } else {
            params.add(identifier(advance()));
        }
        Token arrow = peek();
        consume(TokenType.ARROW, "'=>'");
        if (previous().line() != arrow.line()) {
            throw new ParseException("Line terminator not permitted before arrow", arrow);
        }

        boolean savedAsync = inAsyncContext;
        boolean savedGenerator = inGenerator;
        inAsyncContext = async;
        inGenerator = false;
        try {
            if (check(TokenType.LBRACE)) {
                functionDepth++;
                try {
                    BlockStatement body = parseBlock();
                    return new ArrowFunctionExpression(start.position(), body.end(), start.line(), start.column(),
                        body.endLine(), body.endCol(), false, async, params, body);
                } finally {
                    functionDepth--;
                }
            }
            Expression body = parseExpr(BP_ASSIGNMENT);
            return new ArrowFunctionExpression(start.position(), body.end(), start.line(), start.column(),
                body.endLine(), body.endCol(), true, async, params, body);
        } finally {
            inAsyncContext = savedAsync;
            inGenerator = savedGenerator;
        }
    }

    private Expression parseYieldExpression() {
        Token start = advance();
        boolean delegate = false;
        Expression argument = null;
        if (match(TokenType.STAR)) {
            delegate = true;
            argument = parseExpr(BP_ASSIGNMENT);
        } else if (!isAtEnd() && peek().line() == start.line() && startsExpression(peek())) {
            argument = parseExpr(BP_ASSIGNMENT);
        }
        Token end = previous();
        return new YieldExpression(start.position(), end.endPosition(), start.line(), start.column(),
            end.endLine(), end.endColumn(), argument, delegate);
    }

    // ========================================================================
    // Lookahead helpers
    // ========================================================================

    // Scans from an LPAREN to its matching RPAREN and checks for a following '=>'
    private boolean isArrowParameters(int lparenIndex) {
        int depth = 0;
        for (int i = lparenIndex; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type == TokenType.LPAREN) {
                depth++;
            } else if (type == TokenType.RPAREN) {
                depth--;
                if (depth == 0) {
                    return i + 1 < tokens.size() && tokens.get(i + 1).type() == TokenType.ARROW;
                }
            } else if (type == TokenType.EOF) {
                return false;
            }
        }
        return false;
    }

    private boolean isAsyncArrowStart() {
        Token asyncToken = peek();
        if (current + 1 >= tokens.size()) {
            return false;
        }
        Token next = tokens.get(current + 1);
        if (next.line() != asyncToken.line()) {
            return false;
        }
        if (next.type() == TokenType.IDENTIFIER) {
            return checkAhead(2, TokenType.ARROW);
        }
        return next.type() == TokenType.LPAREN && isArrowParameters(current + 1);
    }

    private boolean isAsyncFunctionStart() {
        Token token = peek();
        return token.lexeme().equals("async") && checkAhead(1, TokenType.FUNCTION)
            && tokens.get(current + 1).line() == token.line();
    }

    private boolean isAwaitAllowed() {
        return inAsyncContext || (forceModuleMode && functionDepth == 0);
    }

    private boolean startsExpression(Token token) {
        return switch (token.type()) {
            case RPAREN, RBRACKET, RBRACE, COMMA, SEMICOLON, COLON, EOF -> false;
            default -> true;
        };
    }

    private boolean isIdentifierName(Token token) {
        return token.type() == TokenType.IDENTIFIER || token.type().isKeyword();
    }

    private void validateSimpleAssignmentTarget(Expression target, Token operator) {
        Expression unwrapped = target;
        while (unwrapped instanceof ParenthesizedExpression paren) {
            unwrapped = paren.expression();
        }
        if (!(unwrapped instanceof Identifier) && !(unwrapped instanceof MemberExpression)) {
            throw new ParseException("Invalid left-hand side in assignment", operator);
        }
    }

    // ========================================================================
    // Node helpers
    // ========================================================================

    private Identifier identifier(Token token) {
        return new Identifier(token.position(), token.endPosition(), token.line(), token.column(),
            token.endLine(), token.endColumn(), token.lexeme());
    }

    private Literal literal(Token token, Object value) {
        return new Literal(token.position(), token.endPosition(), token.line(), token.column(),
            token.endLine(), token.endColumn(), value, token.lexeme());
    }

    // Helper methods

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkAhead(int offset, TokenType type) {
        int pos = current + offset;
        if (pos >= tokens.size()) return false;
        return tokens.get(pos).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(Math.max(current - 1, 0));
    }

    private void consume(TokenType type, String message) {
        if (check(type)) {
            advance();
            return;
        }
        throw new ExpectedTokenException(message, peek());
    }
}
