package com.solparser.ast;

import com.solparser.TokenType;

public record UnaryOperation(
    long id,
    SourceLocation location,
    TokenType operator,
    Expression subExpression,
    boolean prefix
) implements Expression {

    @Override
    public String type() {
        return "UnaryOperation";
    }
}
