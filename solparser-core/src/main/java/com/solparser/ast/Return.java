package com.solparser.ast;

public record Return(
    long id,
    SourceLocation location,
    String documentation,
    Expression expression  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "Return";
    }
}
