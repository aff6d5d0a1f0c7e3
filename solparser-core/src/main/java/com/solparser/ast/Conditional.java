package com.solparser.ast;

public record Conditional(
    long id,
    SourceLocation location,
    Expression condition,
    Expression trueExpression,
    Expression falseExpression
) implements Expression {

    @Override
    public String type() {
        return "Conditional";
    }
}
