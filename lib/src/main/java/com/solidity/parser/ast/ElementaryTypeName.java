package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class ElementaryTypeName extends AstNode implements TypeName {
    private final String name;
    private final String stateMutability;

    public ElementaryTypeName(String name, String stateMutability) {
        super(NodeType.ELEMENTARY_TYPE_NAME);
        this.name = Objects.requireNonNull(name, "name");
        this.stateMutability = stateMutability;
    }

    public String getName() {
        return name;
    }

    /** {@code payable} for {@code address payable}, otherwise {@code null}. */
    public String getStateMutability() {
        return stateMutability;
    }

    @Override
    protected List<Object> components() {
        return fields(name, stateMutability);
    }
}
