package com.solidity.parser.ast;

import java.util.List;

public final class ContinueStatement extends AstNode implements Statement {

    public ContinueStatement() {
        super(NodeType.CONTINUE_STATEMENT);
    }

    @Override
    protected List<Object> components() {
        return List.of();
    }
}
