package com.solparser.assembly;

import com.solparser.ErrorReporter;
import com.solparser.TokenSource;

/**
 * Sub-grammar for inline assembly blocks.
 */
public interface InlineAssemblyParser {

    /**
     * Parses the block starting at the current token, which is expected to be
     * {@code &#123;}. On success the scanner is left on the token after the
     * closing brace. Returns null after reporting to {@code reporter} when the
     * block is malformed.
     */
    AssemblyBlock parse(TokenSource scanner, ErrorReporter reporter);
}
