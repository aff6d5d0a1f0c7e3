package com.solparser.ast;

public record TryCatchClause(
    long id,
    SourceLocation location,
    String errorName,  // empty for the success clause and for a plain 'catch'
    ParameterList parameters,  // Can be null
    Block block
) implements Node {

    @Override
    public String type() {
        return "TryCatchClause";
    }
}
