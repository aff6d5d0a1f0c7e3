package com.solparser;

import com.solparser.ast.Node;
import com.solparser.ast.SourceLocation;

/**
 * Tracks the source range of a node while it is being parsed. The range starts
 * at the current token; its end stays open until {@link #markEndPosition()} or
 * until the node is created.
 */
final class NodeFactory {

    @FunctionalInterface
    interface NodeConstructor<T extends Node> {
        T create(long id, SourceLocation location);
    }

    private final ParserBase parser;
    private SourceLocation location;

    NodeFactory(ParserBase parser) {
        this.parser = parser;
        this.location = new SourceLocation(parser.position(), -1, parser.sourceName());
    }

    /**
     * Starts at {@code child}'s range, for constructs whose first part was parsed before
     * the construct itself was recognized.
     */
    NodeFactory(ParserBase parser, Node child) {
        this.parser = parser;
        this.location = child.location();
    }

    void markEndPosition() {
        location = location.withEnd(parser.endPosition());
    }

    /**
     * Ends the range at {@code end}, never before its start.
     */
    void setEndPosition(int end) {
        location = location.withEnd(Math.max(location.start(), end));
    }

    void setLocation(SourceLocation location) {
        this.location = location;
    }

    /**
     * Collapses the range to its start, for nodes that consume no tokens.
     */
    void setLocationEmpty() {
        location = location.withEnd(location.start());
    }

    void setEndPositionFromNode(Node node) {
        location = location.withEnd(node.location().end());
    }

    SourceLocation location() {
        return location;
    }

    <T extends Node> T create(NodeConstructor<T> constructor) {
        if (location.sourceName() == null) {
            throw new IllegalStateException("Node location has no source");
        }
        if (location.end() < 0) {
            markEndPosition();
        }
        return constructor.create(parser.nextId(), location);
    }
}
