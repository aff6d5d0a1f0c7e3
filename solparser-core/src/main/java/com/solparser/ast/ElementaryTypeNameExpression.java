package com.solparser.ast;

/**
 * An elementary type used as a value, e.g. the callee of {@code uint(x)}.
 */
public record ElementaryTypeNameExpression(
    long id,
    SourceLocation location,
    ElementaryTypeName typeName
) implements Expression {

    @Override
    public String type() {
        return "ElementaryTypeNameExpression";
    }
}
