package com.jsanalyzer.ast;

public sealed interface Expression extends Node permits
    Identifier,
    Literal,
    ThisExpression,
    Super,
    ArrayExpression,
    ObjectExpression,
    FunctionExpression,
    ArrowFunctionExpression,
    ClassExpression,
    TemplateLiteral,
    TaggedTemplateExpression,
    MemberExpression,
    CallExpression,
    NewExpression,
    MetaProperty,
    UpdateExpression,
    UnaryExpression,
    AwaitExpression,
    BinaryExpression,
    LogicalExpression,
    ConditionalExpression,
    AssignmentExpression,
    SequenceExpression,
    YieldExpression,
    ParenthesizedExpression,
    SpreadElement {
}
