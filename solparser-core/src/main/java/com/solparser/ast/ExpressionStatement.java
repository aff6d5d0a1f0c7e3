package com.solparser.ast;

public record ExpressionStatement(
    long id,
    SourceLocation location,
    String documentation,
    Expression expression
) implements Statement {

    @Override
    public String type() {
        return "ExpressionStatement";
    }
}
