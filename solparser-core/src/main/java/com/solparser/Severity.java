package com.solparser;

public enum Severity {
    WARNING,
    ERROR;

    public String label() {
        return this == WARNING ? "Warning" : "Error";
    }
}
