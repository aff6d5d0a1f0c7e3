package com.solparser.ast;

public enum Mutability {
    MUTABLE,
    IMMUTABLE,
    CONSTANT
}
