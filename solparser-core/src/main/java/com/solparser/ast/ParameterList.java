package com.solparser.ast;

import java.util.List;

public record ParameterList(
    long id,
    SourceLocation location,
    List<VariableDeclaration> parameters
) implements Node {

    @Override
    public String type() {
        return "ParameterList";
    }
}
