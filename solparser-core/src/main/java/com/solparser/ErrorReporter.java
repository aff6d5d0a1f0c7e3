package com.solparser;

import com.google.common.flogger.GoogleLogger;
import com.solparser.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Diagnostics sink for one parse session. Not thread-safe; every concurrent parse
 * owns its own reporter.
 */
public class ErrorReporter {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    public static final int MAX_ERRORS_ALLOWED = 256;
    public static final int MAX_WARNINGS_ALLOWED = 256;

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int errorCount = 0;
    private int warningCount = 0;

    public void warning(int code, SourceLocation location, String message) {
        warningCount++;
        if (warningCount > MAX_WARNINGS_ALLOWED) {
            if (warningCount == MAX_WARNINGS_ALLOWED + 1) {
                record(new Diagnostic(4591, Severity.WARNING, location,
                    "There are more than " + MAX_WARNINGS_ALLOWED + " warnings. Ignoring the rest."));
            }
            return;
        }
        record(new Diagnostic(code, Severity.WARNING, location, message));
    }

    /**
     * Records an error. Once the error count passes {@link #MAX_ERRORS_ALLOWED} the
     * parse is aborted with a non-recoverable {@link ParseException}.
     */
    public void error(int code, SourceLocation location, String message) {
        errorCount++;
        record(new Diagnostic(code, Severity.ERROR, location, message));
        if (errorCount == MAX_ERRORS_ALLOWED + 1) {
            Diagnostic abort = new Diagnostic(4013, Severity.ERROR, location,
                "There are more than " + MAX_ERRORS_ALLOWED + " errors. Aborting.");
            record(abort);
            throw new ParseException(abort, false);
        }
    }

    /**
     * Records an error and raises the fatal signal.
     */
    public ParseException fatalParserError(int code, SourceLocation location, String message, boolean recoverable) {
        error(code, location, message);
        throw new ParseException(diagnostics.get(diagnostics.size() - 1), recoverable);
    }

    public ParseException fatalParserError(int code, SourceLocation location, String message) {
        return fatalParserError(code, location, message, true);
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }

    public boolean hasExcessiveErrors() {
        return errorCount > MAX_ERRORS_ALLOWED;
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }

    public void clear() {
        diagnostics.clear();
        errorCount = 0;
        warningCount = 0;
    }

    private void record(Diagnostic diagnostic) {
        logger.atFinest().log("%s", diagnostic);
        diagnostics.add(diagnostic);
    }
}
