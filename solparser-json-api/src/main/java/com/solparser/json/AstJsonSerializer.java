package com.solparser.json;

import com.solparser.ast.Node;

/**
 * Writes AST nodes as JSON. Every node object carries a {@code nodeType}
 * discriminator and its {@code src} range.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if the node cannot be written
     */
    String serialize(Node node) throws AstJsonException;

    String serializePretty(Node node) throws AstJsonException;
}
