package com.solparser.ast;

import java.util.List;

public record ContractDefinition(
    long id,
    SourceLocation location,
    String name,
    StructuredDocumentation documentation,  // Can be null
    List<InheritanceSpecifier> baseContracts,
    List<ContractMember> subNodes,
    ContractKind kind,
    boolean abstractContract
) implements SourceUnitMember {

    @Override
    public String type() {
        return "ContractDefinition";
    }
}
