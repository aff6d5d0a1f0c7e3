package com.solparser.ast;

public sealed interface Expression extends Node permits
    Conditional,
    Assignment,
    TupleExpression,
    UnaryOperation,
    BinaryOperation,
    FunctionCall,
    FunctionCallOptions,
    NewExpression,
    MemberAccess,
    IndexAccess,
    IndexRangeAccess,
    Identifier,
    ElementaryTypeNameExpression,
    Literal {
}
