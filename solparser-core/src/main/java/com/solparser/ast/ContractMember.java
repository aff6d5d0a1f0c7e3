package com.solparser.ast;

/**
 * Items allowed inside a contract, interface or library body.
 */
public sealed interface ContractMember extends Node permits
    FunctionDefinition,
    StructDefinition,
    EnumDefinition,
    VariableDeclaration,
    ModifierDefinition,
    EventDefinition,
    UsingForDirective {
}
