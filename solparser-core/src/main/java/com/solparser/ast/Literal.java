package com.solparser.ast;

import com.solparser.TokenType;

public record Literal(
    long id,
    SourceLocation location,
    TokenType token,
    String value,
    SubDenomination subDenomination
) implements Expression {

    @Override
    public String type() {
        return "Literal";
    }
}
