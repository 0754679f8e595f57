package com.solidity.parser.ast;

import java.util.List;

public final class AssemblyBlock extends AstNode implements AssemblyItem {
    private final List<AssemblyItem> operations;

    public AssemblyBlock(List<? extends AssemblyItem> operations) {
        super(NodeType.ASSEMBLY_BLOCK);
        this.operations = List.copyOf(operations);
    }

    public List<AssemblyItem> getOperations() {
        return operations;
    }

    @Override
    protected List<Object> components() {
        return fields(operations);
    }
}
