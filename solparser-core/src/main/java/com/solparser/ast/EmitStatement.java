package com.solparser.ast;

public record EmitStatement(
    long id,
    SourceLocation location,
    String documentation,
    FunctionCall eventCall
) implements Statement {

    @Override
    public String type() {
        return "EmitStatement";
    }
}
