package com.solparser;

/**
 * Raised after a fatal diagnostic was recorded. Recovery points catch it and
 * resynchronize unless it is marked as not recoverable.
 */
public class ParseException extends RuntimeException {
    private final Diagnostic diagnostic;
    private final boolean recoverable;

    public ParseException(Diagnostic diagnostic, boolean recoverable) {
        super(diagnostic.format());
        this.diagnostic = diagnostic;
        this.recoverable = recoverable;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
