package com.solparser.ast;

public sealed interface TypeName extends Node permits
    ElementaryTypeName,
    UserDefinedTypeName,
    FunctionTypeName,
    Mapping,
    ArrayTypeName {
}
