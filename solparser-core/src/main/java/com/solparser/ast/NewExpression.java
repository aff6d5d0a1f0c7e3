package com.solparser.ast;

public record NewExpression(
    long id,
    SourceLocation location,
    TypeName typeName
) implements Expression {

    @Override
    public String type() {
        return "NewExpression";
    }
}
