package com.solparser.ast;

/**
 * One {@code forall} or {@code exists} binder of a specification expression.
 */
public record Quantifier(boolean forall, ParameterList variables) {
}
