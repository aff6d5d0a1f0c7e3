package com.solparser;

import com.google.common.flogger.GoogleLogger;
import com.solparser.ast.SourceLocation;

/**
 * Token cursor helpers shared by the grammar: expectations, diagnostics and the
 * recovery and recursion bookkeeping of one parser session.
 */
public abstract class ParserBase {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    protected ErrorReporter reporter;
    protected final ParserOptions options;
    protected TokenSource scanner;

    // Set while skipping tokens after a fatal error, cleared once resynchronized
    protected boolean inRecovery = false;

    private int recursionDepth = 0;
    private long nextNodeId = 0;

    protected ParserBase(ErrorReporter reporter, ParserOptions options) {
        this.reporter = reporter;
        this.options = options;
    }

    // ========================================================================
    // Session
    // ========================================================================

    /**
     * Starts a new parse on {@code source}. Node ids keep counting across
     * sessions of the same parser.
     */
    protected void beginSession(TokenSource source) {
        this.scanner = source;
        this.inRecovery = false;
        this.recursionDepth = 0;
    }

    long nextId() {
        return nextNodeId++;
    }

    public ErrorReporter getReporter() {
        return reporter;
    }

    public ParserOptions getOptions() {
        return options;
    }

    // ========================================================================
    // Cursor
    // ========================================================================

    protected TokenType currentToken() {
        return scanner.currentToken();
    }

    protected TokenType peekNextToken() {
        return scanner.peekNextToken();
    }

    protected String currentLiteral() {
        return scanner.currentLiteral();
    }

    protected TokenType advance() {
        return scanner.next();
    }

    protected int position() {
        return scanner.currentLocation().start();
    }

    protected int endPosition() {
        return scanner.currentLocation().end();
    }

    protected SourceLocation currentLocation() {
        return scanner.currentLocation();
    }

    protected String sourceName() {
        return scanner.sourceName();
    }

    protected String getLiteralAndAdvance() {
        String literal = scanner.currentLiteral();
        advance();
        return literal;
    }

    // ========================================================================
    // Expectations
    // ========================================================================

    protected void expectToken(TokenType expected) {
        expectToken(expected, true);
    }

    /**
     * Checks that the current token is {@code expected}. A mismatch is fatal unless
     * error recovery is enabled, in which case it is reported and the cursor stays
     * put so that the enclosing construct can still use the token.
     */
    protected void expectToken(TokenType expected, boolean advance) {
        TokenType actual = currentToken();
        if (actual != expected) {
            String message = "Expected " + tokenName(expected) + " but got " + tokenName(actual);
            if (options.errorRecovery()) {
                parserError(6635, message);
            } else {
                throw fatalParserError(2314, message);
            }
            advance = false;
        }
        if (advance) {
            advance();
        }
    }

    /**
     * Expects the token that closes the node {@code nodeFactory} is building. If it is
     * missing and recovery lets parsing continue, the node ends at the last token it
     * consumed.
     */
    void expectClosingToken(NodeFactory nodeFactory, TokenType expected) {
        if (currentToken() == expected) {
            nodeFactory.markEndPosition();
        } else {
            nodeFactory.setEndPosition(scanner.previousTokenEnd());
        }
        expectToken(expected);
    }

    /**
     * Skips ahead to {@code expected} after a fatal error inside {@code nodeName}.
     * Reaching the end of the source rewinds to where skipping began and raises a
     * fatal error for the next recovery point further out.
     */
    protected void expectTokenOrConsumeUntil(TokenType expected, String nodeName, boolean advance) {
        if (!inRecovery) {
            throw new IllegalStateException("Not in parser recovery");
        }
        TokenType actual = currentToken();
        if (actual != expected) {
            SourceLocation errorLocation = currentLocation();
            int startPosition = errorLocation.start();
            while (currentToken() != expected && currentToken() != TokenType.EOS) {
                advance();
            }
            if (currentToken() == TokenType.EOS) {
                scanner.setPosition(startPosition);
                logger.atFine().log("Recovery in %s reached end of source, unwinding from %d", nodeName, startPosition);
                throw fatalParserError(1957, errorLocation,
                    "In " + nodeName + ", " + tokenName(expected) + " is expected; got " + tokenName(actual) + " instead.");
            }
            parserWarning(3796, "Recovered in " + nodeName + " at " + tokenName(expected) + ".");
        } else {
            parserWarning(3347, "Recovered in " + nodeName + " at " + tokenName(expected) + ".");
        }
        logger.atFine().log("Recovered in %s at offset %d", nodeName, position());
        inRecovery = false;
        if (advance) {
            advance();
        }
    }

    protected void expectTokenOrConsumeUntil(TokenType expected, String nodeName) {
        expectTokenOrConsumeUntil(expected, nodeName, true);
    }

    /**
     * Whether a recovery point may swallow {@code e} and resynchronize.
     */
    protected boolean canRecover(ParseException e) {
        return e.isRecoverable()
            && reporter.hasErrors()
            && options.errorRecovery()
            && !reporter.hasExcessiveErrors();
    }

    /**
     * Recovery point handler: rethrows {@code e} unless recovery is possible, in
     * which case the parser switches into recovery.
     */
    protected void enterRecoveryOrRethrow(ParseException e, String nodeName) {
        if (!canRecover(e)) {
            throw e;
        }
        logger.atFine().log("Entering recovery in %s at offset %d", nodeName, position());
        inRecovery = true;
    }

    // ========================================================================
    // Recursion guard
    // ========================================================================

    /**
     * Enters a recursive construct. Must be paired with {@link #decreaseRecursionDepth()}
     * in a {@code finally} block; when the limit is hit the depth is left unchanged.
     */
    protected void increaseRecursionDepth() {
        if (recursionDepth >= options.maxRecursionDepth()) {
            throw reporter.fatalParserError(7319, currentLocation(), "Maximum recursion depth reached during parsing.", false);
        }
        recursionDepth++;
    }

    protected void decreaseRecursionDepth() {
        if (recursionDepth <= 0) {
            throw new IllegalStateException("Recursion depth underflow");
        }
        recursionDepth--;
    }

    int recursionDepth() {
        return recursionDepth;
    }

    // ========================================================================
    // Diagnostics
    // ========================================================================

    protected String tokenName(TokenType token) {
        if (token == TokenType.IDENTIFIER) {
            return "identifier";
        }
        if (token == TokenType.EOS) {
            return "end of source";
        }
        if (token.isReservedKeyword()) {
            return "reserved keyword '" + token.friendlyName() + "'";
        }
        if (token.isElementaryTypeName() && token == currentToken()) {
            return "'" + scanner.currentElementaryTypeNameToken() + "'";
        }
        return "'" + token.friendlyName() + "'";
    }

    protected void parserWarning(int code, String message) {
        reporter.warning(code, currentLocation(), message);
    }

    protected void parserWarning(int code, SourceLocation location, String message) {
        reporter.warning(code, location, message);
    }

    protected void parserError(int code, String message) {
        reporter.error(code, currentLocation(), message);
    }

    protected void parserError(int code, SourceLocation location, String message) {
        reporter.error(code, location, message);
    }

    /**
     * Records a fatal error and raises it. Declared to return the exception so call
     * sites can write {@code throw fatalParserError(...)}.
     */
    protected ParseException fatalParserError(int code, String message) {
        return reporter.fatalParserError(code, currentLocation(), message);
    }

    protected ParseException fatalParserError(int code, SourceLocation location, String message) {
        return reporter.fatalParserError(code, location, message);
    }
}
