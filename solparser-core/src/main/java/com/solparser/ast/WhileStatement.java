package com.solparser.ast;

public record WhileStatement(
    long id,
    SourceLocation location,
    String documentation,
    Expression condition,
    Statement body,
    boolean doWhile
) implements Statement {

    @Override
    public String type() {
        return "WhileStatement";
    }
}
