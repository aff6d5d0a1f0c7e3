package com.solparser.ast;

import java.util.List;

public record InheritanceSpecifier(
    long id,
    SourceLocation location,
    UserDefinedTypeName baseName,
    List<Expression> arguments  // null when written without parentheses
) implements Node {

    @Override
    public String type() {
        return "InheritanceSpecifier";
    }
}
