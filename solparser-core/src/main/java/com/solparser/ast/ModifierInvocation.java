package com.solparser.ast;

import java.util.List;

/**
 * A modifier or base constructor call in a function header.
 */
public record ModifierInvocation(
    long id,
    SourceLocation location,
    Identifier name,
    List<Expression> arguments  // null when written without parentheses
) implements Node {

    @Override
    public String type() {
        return "ModifierInvocation";
    }
}
