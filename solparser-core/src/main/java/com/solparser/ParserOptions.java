package com.solparser;

import com.solparser.assembly.BracedAssemblyParser;
import com.solparser.assembly.InlineAssemblyParser;
import com.solparser.version.SemVerVersion;

/**
 * Settings of a parser session.
 *
 * @param errorRecovery     resynchronize after fatal errors at contract, block and statement level
 * @param maxRecursionDepth nesting depth at which parsing aborts
 * @param compilerVersion   version that {@code pragma solidity} constraints are checked against
 * @param assemblyParser    sub-grammar used for {@code assembly} blocks
 */
public record ParserOptions(
    boolean errorRecovery,
    int maxRecursionDepth,
    SemVerVersion compilerVersion,
    InlineAssemblyParser assemblyParser
) {
    public static final int DEFAULT_MAX_RECURSION_DEPTH = 1200;
    public static final String DEFAULT_COMPILER_VERSION = "0.7.6";

    public ParserOptions {
        if (maxRecursionDepth <= 0) {
            throw new IllegalArgumentException("maxRecursionDepth must be positive");
        }
        if (compilerVersion == null) {
            throw new IllegalArgumentException("compilerVersion must not be null");
        }
        if (assemblyParser == null) {
            throw new IllegalArgumentException("assemblyParser must not be null");
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(false, DEFAULT_MAX_RECURSION_DEPTH,
            SemVerVersion.parse(DEFAULT_COMPILER_VERSION), new BracedAssemblyParser());
    }

    public ParserOptions withErrorRecovery(boolean errorRecovery) {
        return new ParserOptions(errorRecovery, maxRecursionDepth, compilerVersion, assemblyParser);
    }

    public ParserOptions withMaxRecursionDepth(int maxRecursionDepth) {
        return new ParserOptions(errorRecovery, maxRecursionDepth, compilerVersion, assemblyParser);
    }

    public ParserOptions withCompilerVersion(String compilerVersion) {
        return new ParserOptions(errorRecovery, maxRecursionDepth, SemVerVersion.parse(compilerVersion), assemblyParser);
    }

    public ParserOptions withAssemblyParser(InlineAssemblyParser assemblyParser) {
        return new ParserOptions(errorRecovery, maxRecursionDepth, compilerVersion, assemblyParser);
    }
}
