package com.solparser.ast;

public enum Visibility {
    DEFAULT,
    PRIVATE,
    INTERNAL,
    PUBLIC,
    EXTERNAL
}
