package com.solidity.parser.ast;

import java.util.List;

public final class BreakStatement extends AstNode implements Statement {

    public BreakStatement() {
        super(NodeType.BREAK_STATEMENT);
    }

    @Override
    protected List<Object> components() {
        return List.of();
    }
}
