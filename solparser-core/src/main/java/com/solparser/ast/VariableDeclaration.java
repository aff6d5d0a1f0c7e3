package com.solparser.ast;

public record VariableDeclaration(
    long id,
    SourceLocation location,
    TypeName typeName,
    String name,  // empty for unnamed parameters
    Expression value,  // Can be null
    Visibility visibility,
    StructuredDocumentation documentation,  // Can be null
    boolean stateVariable,
    boolean indexed,
    Mutability mutability,
    OverrideSpecifier overrides,  // Can be null
    DataLocation storageLocation
) implements ContractMember {

    @Override
    public String type() {
        return "VariableDeclaration";
    }
}
