package com.solparser.ast;

/**
 * Items allowed at file level.
 */
public sealed interface SourceUnitMember extends Node permits
    PragmaDirective,
    ImportDirective,
    ContractDefinition,
    StructDefinition,
    EnumDefinition,
    FunctionDefinition {
}
