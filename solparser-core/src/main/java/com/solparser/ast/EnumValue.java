package com.solparser.ast;

public record EnumValue(
    long id,
    SourceLocation location,
    String name
) implements Node {

    @Override
    public String type() {
        return "EnumValue";
    }
}
