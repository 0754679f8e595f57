package com.solidity.parser.ast;

import java.util.List;

public final class Break extends AstNode implements AssemblyItem {

    public Break() {
        super(NodeType.BREAK);
    }

    @Override
    protected List<Object> components() {
        return List.of();
    }
}
