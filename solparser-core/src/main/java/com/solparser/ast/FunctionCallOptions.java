package com.solparser.ast;

import java.util.List;

/**
 * {@code f{value: 1, gas: 2}}
 */
public record FunctionCallOptions(
    long id,
    SourceLocation location,
    Expression expression,
    List<Expression> options,
    List<String> names
) implements Expression {

    @Override
    public String type() {
        return "FunctionCallOptions";
    }
}
