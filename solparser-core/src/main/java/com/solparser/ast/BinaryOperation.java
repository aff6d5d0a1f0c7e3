package com.solparser.ast;

import com.solparser.TokenType;

public record BinaryOperation(
    long id,
    SourceLocation location,
    Expression leftExpression,
    TokenType operator,
    Expression rightExpression
) implements Expression {

    @Override
    public String type() {
        return "BinaryOperation";
    }
}
