package com.solparser.ast;

import java.util.List;

/**
 * Root of a parsed file.
 */
public record SourceUnit(
    long id,
    SourceLocation location,
    String licenseString,  // null when no single SPDX identifier was found
    List<SourceUnitMember> nodes
) implements Node {

    @Override
    public String type() {
        return "SourceUnit";
    }
}
