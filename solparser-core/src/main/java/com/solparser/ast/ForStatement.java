package com.solparser.ast;

public record ForStatement(
    long id,
    SourceLocation location,
    String documentation,
    Statement initializationExpression,  // Can be null
    Expression condition,  // Can be null
    ExpressionStatement loopExpression,  // Can be null
    Statement body
) implements Statement {

    @Override
    public String type() {
        return "ForStatement";
    }
}
