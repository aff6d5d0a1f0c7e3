package com.solparser.ast;

import java.util.List;

public record ImportDirective(
    long id,
    SourceLocation location,
    String path,
    String unitAlias,  // empty when not aliased
    List<SymbolAlias> symbolAliases
) implements SourceUnitMember {

    /**
     * One entry of {@code import {a as b} from "x";}. {@code alias} is null when not renamed.
     */
    public record SymbolAlias(Identifier symbol, String alias, SourceLocation aliasLocation) {}

    @Override
    public String type() {
        return "ImportDirective";
    }
}
