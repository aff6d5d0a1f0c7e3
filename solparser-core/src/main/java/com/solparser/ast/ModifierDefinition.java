package com.solparser.ast;

public record ModifierDefinition(
    long id,
    SourceLocation location,
    String name,
    StructuredDocumentation documentation,  // Can be null
    ParameterList parameters,
    boolean virtual,
    OverrideSpecifier overrides,  // Can be null
    Block body  // Can be null
) implements ContractMember {

    @Override
    public String type() {
        return "ModifierDefinition";
    }
}
