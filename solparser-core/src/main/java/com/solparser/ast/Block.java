package com.solparser.ast;

import java.util.List;

public record Block(
    long id,
    SourceLocation location,
    String documentation,
    List<Statement> statements
) implements Statement {

    @Override
    public String type() {
        return "Block";
    }
}
