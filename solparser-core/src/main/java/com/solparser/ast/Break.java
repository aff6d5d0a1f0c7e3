package com.solparser.ast;

public record Break(
    long id,
    SourceLocation location,
    String documentation
) implements Statement {

    @Override
    public String type() {
        return "Break";
    }
}
