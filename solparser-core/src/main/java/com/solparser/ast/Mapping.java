package com.solparser.ast;

public record Mapping(
    long id,
    SourceLocation location,
    TypeName keyType,
    TypeName valueType
) implements TypeName {

    @Override
    public String type() {
        return "Mapping";
    }
}
