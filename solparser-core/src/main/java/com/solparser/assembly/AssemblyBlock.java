package com.solparser.assembly;

import com.solparser.ast.SourceLocation;

/**
 * Opaque result of the inline assembly sub-grammar: the braced block's source
 * range and its raw text.
 */
public record AssemblyBlock(SourceLocation location, String code) {
}
