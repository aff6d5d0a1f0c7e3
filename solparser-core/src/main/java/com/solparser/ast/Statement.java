package com.solparser.ast;

public sealed interface Statement extends Node permits
    Block,
    PlaceholderStatement,
    IfStatement,
    TryStatement,
    WhileStatement,
    ForStatement,
    Continue,
    Break,
    Return,
    Throw,
    EmitStatement,
    VariableDeclarationStatement,
    ExpressionStatement,
    InlineAssembly {

    /**
     * Doc comment text directly preceding the statement, null if there is none.
     */
    String documentation();
}
