package com.solparser.ast;

public enum StateMutability {
    PURE,
    VIEW,
    NON_PAYABLE,
    PAYABLE
}
