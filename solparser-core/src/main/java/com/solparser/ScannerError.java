package com.solparser;

/**
 * Reason attached to an {@link TokenType#ILLEGAL} token.
 */
public enum ScannerError {
    NO_ERROR("No error."),
    ILLEGAL_TOKEN("Invalid token."),
    ILLEGAL_HEX_STRING("Expected even number of hex-nibbles."),
    ILLEGAL_HEX_DIGIT("Hexadecimal digit missing or invalid."),
    ILLEGAL_COMMENT_TERMINATOR("Expected multi-line comment-terminator."),
    ILLEGAL_ESCAPE_SEQUENCE("Invalid escape sequence."),
    UNICODE_CHARACTER_IN_NON_UNICODE_STRING("Invalid character in string. If you are trying to use Unicode characters, use a unicode\"...\" string literal."),
    ILLEGAL_CHARACTER_IN_STRING("Invalid character in string."),
    ILLEGAL_STRING_END_QUOTE("Expected string end-quote."),
    ILLEGAL_NUMBER_SEPARATOR("Invalid use of number separator '_'."),
    ILLEGAL_EXPONENT("Invalid exponent."),
    ILLEGAL_NUMBER_END("Identifier-start is not allowed at end of a number."),
    OCTAL_NOT_ALLOWED("Octal numbers not allowed.");

    private final String message;

    ScannerError(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
