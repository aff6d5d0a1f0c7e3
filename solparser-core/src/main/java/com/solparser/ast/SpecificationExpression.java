package com.solparser.ast;

import java.util.List;

/**
 * A verification annotation: an expression together with the variables bound by
 * its quantifier prefix.
 *
 * @param expression  the body
 * @param quantifiers binders in source order, outermost first
 * @param arrayId     the array named by a {@code property(a)} form, otherwise null
 */
public record SpecificationExpression(Expression expression, List<Quantifier> quantifiers, Identifier arrayId) {

    public boolean isArrayProperty() {
        return arrayId != null;
    }
}
