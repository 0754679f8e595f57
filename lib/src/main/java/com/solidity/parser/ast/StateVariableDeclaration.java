package com.solidity.parser.ast;

import java.util.List;

public final class StateVariableDeclaration extends AstNode implements ContractPart {
    private final List<StateVariableDeclarationVariable> variables;
    private final Expression initialValue;

    public StateVariableDeclaration(
            List<StateVariableDeclarationVariable> variables, Expression initialValue) {
        super(NodeType.STATE_VARIABLE_DECLARATION);
        this.variables = List.copyOf(variables);
        this.initialValue = initialValue;
    }

    public List<StateVariableDeclarationVariable> getVariables() {
        return variables;
    }

    public Expression getInitialValue() {
        return initialValue;
    }

    @Override
    protected List<Object> components() {
        return fields(variables, initialValue);
    }
}
