package com.solparser.ast;

import com.solparser.TokenType;

import java.util.List;

public record PragmaDirective(
    long id,
    SourceLocation location,
    List<TokenType> tokens,
    List<String> literals
) implements SourceUnitMember {

    @Override
    public String type() {
        return "PragmaDirective";
    }
}
