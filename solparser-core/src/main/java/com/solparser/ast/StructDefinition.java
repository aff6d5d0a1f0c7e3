package com.solparser.ast;

import java.util.List;

public record StructDefinition(
    long id,
    SourceLocation location,
    String name,
    List<VariableDeclaration> members
) implements SourceUnitMember, ContractMember {

    @Override
    public String type() {
        return "StructDefinition";
    }
}
