package com.solidity.parser.ast;

import java.util.List;

public final class Continue extends AstNode implements AssemblyItem {

    public Continue() {
        super(NodeType.CONTINUE);
    }

    @Override
    protected List<Object> components() {
        return List.of();
    }
}
