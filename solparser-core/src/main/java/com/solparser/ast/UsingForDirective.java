package com.solparser.ast;

public record UsingForDirective(
    long id,
    SourceLocation location,
    UserDefinedTypeName libraryName,
    TypeName typeName  // null for 'using L for *'
) implements ContractMember {

    @Override
    public String type() {
        return "UsingForDirective";
    }
}
