package com.solparser.ast;

import java.util.List;

public record OverrideSpecifier(
    long id,
    SourceLocation location,
    List<UserDefinedTypeName> overrides  // empty for a bare 'override'
) implements Node {

    @Override
    public String type() {
        return "OverrideSpecifier";
    }
}
