package com.solparser.ast;

public record MemberAccess(
    long id,
    SourceLocation location,
    Expression expression,
    String memberName
) implements Expression {

    @Override
    public String type() {
        return "MemberAccess";
    }
}
