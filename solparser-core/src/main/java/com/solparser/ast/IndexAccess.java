package com.solparser.ast;

public record IndexAccess(
    long id,
    SourceLocation location,
    Expression baseExpression,
    Expression indexExpression  // null for 'T[]' used as a type expression
) implements Expression {

    @Override
    public String type() {
        return "IndexAccess";
    }
}
