package com.solparser.ast;

public record Continue(
    long id,
    SourceLocation location,
    String documentation
) implements Statement {

    @Override
    public String type() {
        return "Continue";
    }
}
