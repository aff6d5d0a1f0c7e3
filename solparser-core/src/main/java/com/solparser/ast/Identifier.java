package com.solparser.ast;

public record Identifier(
    long id,
    SourceLocation location,
    String name
) implements Expression {

    @Override
    public String type() {
        return "Identifier";
    }
}
