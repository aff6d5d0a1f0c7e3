package com.solparser.ast;

/**
 * Base interface for all AST nodes. Every node carries an id that is unique
 * within the parser session that produced it, and the byte range it was parsed from.
 */
public sealed interface Node permits
    SourceUnit,
    SourceUnitMember,
    ContractMember,
    Statement,
    Expression,
    TypeName,
    InheritanceSpecifier,
    EnumValue,
    ParameterList,
    OverrideSpecifier,
    ModifierInvocation,
    StructuredDocumentation,
    TryCatchClause {

    long id();

    SourceLocation location();

    String type();
}
