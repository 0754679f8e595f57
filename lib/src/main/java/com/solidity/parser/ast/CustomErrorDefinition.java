package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class CustomErrorDefinition extends AstNode implements SourceUnitPart, ContractPart {
    private final String name;
    private final List<VariableDeclaration> parameters;

    public CustomErrorDefinition(String name, List<VariableDeclaration> parameters) {
        super(NodeType.CUSTOM_ERROR_DEFINITION);
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = List.copyOf(parameters);
    }

    public String getName() {
        return name;
    }

    public List<VariableDeclaration> getParameters() {
        return parameters;
    }

    @Override
    protected List<Object> components() {
        return fields(name, parameters);
    }
}
