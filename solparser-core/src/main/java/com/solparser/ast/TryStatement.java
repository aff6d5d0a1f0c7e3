package com.solparser.ast;

import java.util.List;

public record TryStatement(
    long id,
    SourceLocation location,
    String documentation,
    Expression externalCall,
    List<TryCatchClause> clauses  // success clause first
) implements Statement {

    @Override
    public String type() {
        return "TryStatement";
    }
}
