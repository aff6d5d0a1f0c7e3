package com.solparser.ast;

import java.util.List;

public record FunctionDefinition(
    long id,
    SourceLocation location,
    String name,  // empty for constructor, fallback and receive
    Visibility visibility,
    StateMutability stateMutability,
    boolean free,
    FunctionKind kind,
    boolean virtual,
    OverrideSpecifier overrides,  // Can be null
    StructuredDocumentation documentation,  // Can be null
    ParameterList parameters,
    List<ModifierInvocation> modifiers,
    ParameterList returnParameters,
    Block body  // null when declared without implementation
) implements SourceUnitMember, ContractMember {

    @Override
    public String type() {
        return "FunctionDefinition";
    }
}
