package com.jsanalyzer.analyze.precedence;

import com.jsanalyzer.ast.*;

/**
 * The closed set of expression variants that precedence and parenthesization decisions
 * distinguish.
 *
 * <p>Decision procedures switch over this enum without a {@code default} branch, so adding a
 * variant is a compile error at every site that has to consider it.</p>
 */
public enum ExpressionKind {
    IDENTIFIER,
    LITERAL,
    THIS,
    SUPER,
    ARRAY,
    OBJECT,
    FUNCTION,
    ARROW_FUNCTION,
    CLASS,
    TEMPLATE,
    TAGGED_TEMPLATE,
    STATIC_MEMBER,
    COMPUTED_MEMBER,
    META_PROPERTY,
    CALL,
    NEW,
    PRE_UPDATE,
    POST_UPDATE,
    UNARY,
    AWAIT,
    BINARY,
    IN,
    LOGICAL,
    CONDITIONAL,
    ASSIGNMENT,
    SEQUENCE,
    YIELD,
    SPREAD,
    PARENTHESIZED;

    public static ExpressionKind of(Expression expression) {
        if (expression instanceof Identifier) return IDENTIFIER;
        if (expression instanceof Literal) return LITERAL;
        if (expression instanceof ThisExpression) return THIS;
        if (expression instanceof Super) return SUPER;
        if (expression instanceof ArrayExpression) return ARRAY;
        if (expression instanceof ObjectExpression) return OBJECT;
        if (expression instanceof FunctionExpression) return FUNCTION;
        if (expression instanceof ArrowFunctionExpression) return ARROW_FUNCTION;
        if (expression instanceof ClassExpression) return CLASS;
        if (expression instanceof TemplateLiteral) return TEMPLATE;
        if (expression instanceof TaggedTemplateExpression) return TAGGED_TEMPLATE;
        if (expression instanceof MemberExpression member) return member.computed() ? COMPUTED_MEMBER : STATIC_MEMBER;
        if (expression instanceof MetaProperty) return META_PROPERTY;
        if (expression instanceof CallExpression) return CALL;
        if (expression instanceof NewExpression) return NEW;
        if (expression instanceof UpdateExpression update) return update.prefix() ? PRE_UPDATE : POST_UPDATE;
        if (expression instanceof UnaryExpression) return UNARY;
        if (expression instanceof AwaitExpression) return AWAIT;
        if (expression instanceof BinaryExpression binary) return binary.operator().equals("in") ? IN : BINARY;
        if (expression instanceof LogicalExpression) return LOGICAL;
        if (expression instanceof ConditionalExpression) return CONDITIONAL;
        if (expression instanceof AssignmentExpression) return ASSIGNMENT;
        if (expression instanceof SequenceExpression) return SEQUENCE;
        if (expression instanceof YieldExpression) return YIELD;
        if (expression instanceof SpreadElement) return SPREAD;
        if (expression instanceof ParenthesizedExpression) return PARENTHESIZED;
        throw new IllegalArgumentException("Unknown expression type: " + expression.type());
    }
}
