package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class UncheckedStatement extends AstNode implements Statement {
    private final Block block;

    public UncheckedStatement(Block block) {
        super(NodeType.UNCHECKED_STATEMENT);
        this.block = Objects.requireNonNull(block, "block");
    }

    public Block getBlock() {
        return block;
    }

    @Override
    protected List<Object> components() {
        return fields(block);
    }
}
