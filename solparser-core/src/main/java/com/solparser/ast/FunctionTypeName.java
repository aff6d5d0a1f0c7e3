package com.solparser.ast;

public record FunctionTypeName(
    long id,
    SourceLocation location,
    ParameterList parameterTypes,
    ParameterList returnParameterTypes,
    Visibility visibility,
    StateMutability stateMutability
) implements TypeName {

    @Override
    public String type() {
        return "FunctionTypeName";
    }
}
