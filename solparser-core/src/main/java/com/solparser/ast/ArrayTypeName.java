package com.solparser.ast;

public record ArrayTypeName(
    long id,
    SourceLocation location,
    TypeName baseType,
    Expression length  // null for dynamically-sized arrays
) implements TypeName {

    @Override
    public String type() {
        return "ArrayTypeName";
    }
}
