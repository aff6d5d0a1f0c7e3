package com.solparser.ast;

/**
 * The {@code _} statement of a modifier body.
 */
public record PlaceholderStatement(
    long id,
    SourceLocation location,
    String documentation
) implements Statement {

    @Override
    public String type() {
        return "PlaceholderStatement";
    }
}
