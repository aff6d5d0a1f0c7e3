package com.solparser.ast;

import java.util.List;

public record EnumDefinition(
    long id,
    SourceLocation location,
    String name,
    List<EnumValue> members
) implements SourceUnitMember, ContractMember {

    @Override
    public String type() {
        return "EnumDefinition";
    }
}
