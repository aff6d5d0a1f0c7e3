package com.solparser.ast;

/**
 * NatSpec comment attached to a declaration.
 */
public record StructuredDocumentation(
    long id,
    SourceLocation location,
    String text
) implements Node {

    @Override
    public String type() {
        return "StructuredDocumentation";
    }
}
