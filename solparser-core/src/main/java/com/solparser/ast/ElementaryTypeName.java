package com.solparser.ast;

import com.solparser.ElementaryTypeNameToken;

public record ElementaryTypeName(
    long id,
    SourceLocation location,
    ElementaryTypeNameToken typeName,
    StateMutability stateMutability  // only set for address, null otherwise
) implements TypeName {

    @Override
    public String type() {
        return "ElementaryTypeName";
    }
}
