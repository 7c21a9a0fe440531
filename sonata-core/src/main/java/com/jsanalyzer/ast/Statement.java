package com.jsanalyzer.ast;

public sealed interface Statement extends Node permits
    ExpressionStatement,
    VariableDeclaration,
    FunctionDeclaration,
    ClassDeclaration,
    ReturnStatement,
    BlockStatement,
    IfStatement,
    EmptyStatement {
}
