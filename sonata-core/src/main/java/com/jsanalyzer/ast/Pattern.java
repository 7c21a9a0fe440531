package com.jsanalyzer.ast;

public sealed interface Pattern extends Node permits Identifier, MemberExpression {
}
