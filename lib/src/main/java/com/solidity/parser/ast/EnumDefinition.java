package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class EnumDefinition extends AstNode implements SourceUnitPart, ContractPart {
    private final String name;
    private final List<EnumValue> members;

    public EnumDefinition(String name, List<EnumValue> members) {
        super(NodeType.ENUM_DEFINITION);
        this.name = Objects.requireNonNull(name, "name");
        this.members = List.copyOf(members);
    }

    public String getName() {
        return name;
    }

    public List<EnumValue> getMembers() {
        return members;
    }

    @Override
    protected List<Object> components() {
        return fields(name, members);
    }
}
