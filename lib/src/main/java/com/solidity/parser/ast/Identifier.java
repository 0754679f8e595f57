package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class Identifier extends AstNode implements Expression, AssemblyExpression {
    private final String name;

    public Identifier(String name) {
        super(NodeType.IDENTIFIER);
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
