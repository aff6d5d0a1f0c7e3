package com.solparser.ast;

import com.solparser.TokenType;

public record Assignment(
    long id,
    SourceLocation location,
    Expression leftHandSide,
    TokenType operator,
    Expression rightHandSide
) implements Expression {

    @Override
    public String type() {
        return "Assignment";
    }
}
