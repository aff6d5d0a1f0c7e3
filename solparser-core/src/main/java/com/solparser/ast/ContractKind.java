package com.solparser.ast;

public enum ContractKind {
    INTERFACE,
    CONTRACT,
    LIBRARY
}
