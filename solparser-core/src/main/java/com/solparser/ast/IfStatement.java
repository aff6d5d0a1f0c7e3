package com.solparser.ast;

public record IfStatement(
    long id,
    SourceLocation location,
    String documentation,
    Expression condition,
    Statement trueBody,
    Statement falseBody  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "IfStatement";
    }
}
