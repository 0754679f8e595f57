package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class StructDefinition extends AstNode implements SourceUnitPart, ContractPart {
    private final String name;
    private final List<VariableDeclaration> members;

    public StructDefinition(String name, List<VariableDeclaration> members) {
        super(NodeType.STRUCT_DEFINITION);
        this.name = Objects.requireNonNull(name, "name");
        this.members = List.copyOf(members);
    }

    public String getName() {
        return name;
    }

    public List<VariableDeclaration> getMembers() {
        return members;
    }

    @Override
    protected List<Object> components() {
        return fields(name, members);
    }
}
