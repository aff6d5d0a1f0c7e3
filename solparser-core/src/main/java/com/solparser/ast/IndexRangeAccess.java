package com.solparser.ast;

public record IndexRangeAccess(
    long id,
    SourceLocation location,
    Expression baseExpression,
    Expression startExpression,  // Can be null
    Expression endExpression  // Can be null
) implements Expression {

    @Override
    public String type() {
        return "IndexRangeAccess";
    }
}
