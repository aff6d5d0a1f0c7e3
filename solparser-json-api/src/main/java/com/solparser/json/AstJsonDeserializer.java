package com.solparser.json;

import com.solparser.ast.Node;
import com.solparser.ast.SourceUnit;

/**
 * Reads AST nodes back from the JSON written by {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * Reads a whole source unit.
     *
     * @throws AstJsonException if the JSON is malformed or names an unknown node type
     */
    SourceUnit deserializeSourceUnit(String json) throws AstJsonException;

    /**
     * Reads a node of the given type, or of any subtype when {@code type} is one of
     * the node interfaces.
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
