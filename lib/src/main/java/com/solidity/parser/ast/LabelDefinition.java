package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class LabelDefinition extends AstNode implements AssemblyItem {
    private final String name;

    public LabelDefinition(String name) {
        super(NodeType.LABEL_DEFINITION);
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    @Override
    protected List<Object> components() {
        return fields(name);
    }
}
