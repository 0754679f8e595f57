package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class EnumValue extends AstNode {
    private final String name;

    public EnumValue(String name) {
        super(NodeType.ENUM_VALUE);
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
