package com.solparser.ast;

public record EventDefinition(
    long id,
    SourceLocation location,
    String name,
    StructuredDocumentation documentation,  // Can be null
    ParameterList parameters,
    boolean anonymous
) implements ContractMember {

    @Override
    public String type() {
        return "EventDefinition";
    }
}
