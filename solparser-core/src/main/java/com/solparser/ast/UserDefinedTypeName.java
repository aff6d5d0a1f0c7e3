package com.solparser.ast;

import java.util.List;

public record UserDefinedTypeName(
    long id,
    SourceLocation location,
    List<String> namePath
) implements TypeName {

    @Override
    public String type() {
        return "UserDefinedTypeName";
    }
}
