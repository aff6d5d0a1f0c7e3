package com.solparser.ast;

import java.util.List;

/**
 * A parenthesized tuple or a bracketed inline array.
 */
public record TupleExpression(
    long id,
    SourceLocation location,
    List<Expression> components,  // null entries are omitted components
    boolean inlineArray
) implements Expression {

    @Override
    public String type() {
        return "TupleExpression";
    }
}
