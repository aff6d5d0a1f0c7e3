package com.solparser;

import com.solparser.ast.SourceLocation;

/**
 * The cursor the parser reads tokens from. Implementations must be able to look
 * two tokens ahead and to move back to an earlier offset of the same source.
 * All offsets are UTF-8 byte offsets.
 */
public interface TokenSource {

    TokenType currentToken();

    /**
     * Literal of the current token: the name of an identifier, the decoded value of a
     * string, the digits of a number. Empty for tokens without a literal.
     */
    String currentLiteral();

    /**
     * Doc comment text directly preceding the current token, or the empty string.
     */
    String currentCommentLiteral();

    SourceLocation currentCommentLocation();

    /**
     * Size parameters of the current token; only valid on elementary type names.
     */
    ElementaryTypeNameToken currentElementaryTypeNameToken();

    ScannerError currentError();

    SourceLocation currentLocation();

    /**
     * End of the token before the current one, or the start of the first token.
     */
    int previousTokenEnd();

    TokenType peekNextToken();

    TokenType peekNextNextToken();

    /**
     * Advances to the next token and returns its kind. Stays on {@link TokenType#EOS}.
     */
    TokenType next();

    /**
     * Moves the cursor back (or forward) to the first token starting at or after {@code offset}.
     */
    void setPosition(int offset);

    String source();

    String sourceName();

    /**
     * Source text between two byte offsets.
     */
    String text(int start, int end);
}
