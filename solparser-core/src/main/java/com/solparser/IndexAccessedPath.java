package com.solparser;

import com.solparser.ast.Expression;
import com.solparser.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * A statement prefix of the form {@code a.b.c[x][y:z]} consumed before it is known
 * whether it names a type (a declaration follows) or starts an expression.
 * Path entries are identifiers, or a single elementary type name expression.
 */
final class IndexAccessedPath {

    /**
     * One bracket suffix. {@code range} is set for {@code [start:end]}, where either
     * bound may be missing.
     */
    record Index(Expression start, Expression end, boolean range, SourceLocation location) {
    }

    final List<Expression> path = new ArrayList<>();
    final List<Index> indices = new ArrayList<>();

    boolean isEmpty() {
        if (!indices.isEmpty()) {
            if (path.isEmpty()) {
                throw new IllegalStateException("Index suffixes without a path");
            }
        }
        return path.isEmpty();
    }
}
