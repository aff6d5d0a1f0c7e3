package com.solparser.ast;

public enum DataLocation {
    UNSPECIFIED,
    STORAGE,
    MEMORY,
    CALLDATA
}
