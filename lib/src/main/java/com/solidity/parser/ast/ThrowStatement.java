package com.solidity.parser.ast;

import java.util.List;

public final class ThrowStatement extends AstNode implements Statement {

    public ThrowStatement() {
        super(NodeType.THROW_STATEMENT);
    }

    @Override
    protected List<Object> components() {
        return List.of();
    }
}
