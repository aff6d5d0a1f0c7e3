package com.solparser.ast;

/**
 * One {@code case pre : post;} entry of a case-split specification.
 */
public record SpecificationCase(SpecificationExpression precondition, SpecificationExpression postcondition) {
}
