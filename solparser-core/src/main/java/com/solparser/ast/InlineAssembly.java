package com.solparser.ast;

import com.solparser.assembly.AssemblyBlock;

public record InlineAssembly(
    long id,
    SourceLocation location,
    String documentation,
    String dialect,
    AssemblyBlock operations
) implements Statement {

    @Override
    public String type() {
        return "InlineAssembly";
    }
}
