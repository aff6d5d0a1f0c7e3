package com.solparser;

import com.solparser.ast.SourceLocation;

/**
 * A single recorded diagnostic. {@code code} is the stable numeric id of the
 * condition; it never changes between releases even when the message does.
 */
public record Diagnostic(int code, Severity severity, SourceLocation location, String message) {

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Renders as {@code name:start: Error 2314: message}.
     */
    public String format() {
        String where = location == null ? "<unknown>" : location.sourceName() + ":" + location.start();
        return where + ": " + severity.label() + " " + code + ": " + message;
    }

    @Override
    public String toString() {
        return format();
    }
}
