package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class EventDefinition extends AstNode implements SourceUnitPart, ContractPart {
    private final String name;
    private final List<VariableDeclaration> parameters;
    private final boolean isAnonymous;

    public EventDefinition(String name, List<VariableDeclaration> parameters, boolean isAnonymous) {
        super(NodeType.EVENT_DEFINITION);
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = List.copyOf(parameters);
        this.isAnonymous = isAnonymous;
    }

    public String getName() {
        return name;
    }

    public List<VariableDeclaration> getParameters() {
        return parameters;
    }

    public boolean isAnonymous() {
        return isAnonymous;
    }

    @Override
    protected List<Object> components() {
        return fields(name, parameters, isAnonymous);
    }
}
