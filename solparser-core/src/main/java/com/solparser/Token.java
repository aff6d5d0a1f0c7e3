package com.solparser;

/**
 * A scanned token. {@code firstSize}/{@code secondSize} are only meaningful for
 * sized elementary type names; {@code comment} is the doc comment that directly
 * precedes the token, or the empty string.
 */
public record Token(
    TokenType type,
    String literal,
    int start,
    int end,
    int firstSize,
    int secondSize,
    ScannerError error,
    String comment,
    int commentStart,
    int commentEnd
) {
    public Token(TokenType type, String literal, int start, int end) {
        this(type, literal, start, end, 0, 0, ScannerError.NO_ERROR, "", -1, -1);
    }
}
