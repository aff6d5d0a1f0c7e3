package com.solparser.ast;

public record Throw(
    long id,
    SourceLocation location,
    String documentation
) implements Statement {

    @Override
    public String type() {
        return "Throw";
    }
}
