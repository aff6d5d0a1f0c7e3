package com.solparser.ast;

import java.util.List;

public record VariableDeclarationStatement(
    long id,
    SourceLocation location,
    String documentation,
    List<VariableDeclaration> declarations,  // null entries are omitted tuple components
    Expression initialValue  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "VariableDeclarationStatement";
    }
}
