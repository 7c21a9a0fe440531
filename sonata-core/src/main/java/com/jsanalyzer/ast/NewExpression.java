package com.jsanalyzer.ast;

import java.util.List;

public record NewExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression callee,
    List<Expression> arguments   // Empty when written without parentheses
) implements Expression {
    public NewExpression(Expression callee, List<Expression> arguments) {
        this(0, 0, 0, 0, 0, 0, callee, arguments);
    }

    @Override
    public String type() {
        return "NewExpression";
    }
}
