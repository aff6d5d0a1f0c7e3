package com.solparser.ast;

public enum FunctionKind {
    FUNCTION,
    CONSTRUCTOR,
    FALLBACK,
    RECEIVE
}
