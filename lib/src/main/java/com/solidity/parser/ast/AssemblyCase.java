package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class AssemblyCase extends AstNode {
    private final AssemblyExpression value;
    private final AssemblyBlock block;

    public AssemblyCase(AssemblyExpression value, AssemblyBlock block) {
        super(NodeType.ASSEMBLY_CASE);
        this.value = value;
        this.block = Objects.requireNonNull(block, "block");
    }

    /** Case literal, or {@code null} for the {@code default} case. */
    public AssemblyExpression getValue() {
        return value;
    }

    public AssemblyBlock getBlock() {
        return block;
    }

    public boolean isDefault() {
        return value == null;
    }

    @Override
    protected List<Object> components() {
        return fields(value, block);
    }
}
