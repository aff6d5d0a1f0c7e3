package com.solparser.ast;

import java.util.List;

public record FunctionCall(
    long id,
    SourceLocation location,
    Expression expression,
    List<Expression> arguments,
    List<String> names  // empty for positional arguments
) implements Expression {

    @Override
    public String type() {
        return "FunctionCall";
    }
}
