package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class FunctionTypeName extends AstNode implements TypeName {
    private final List<VariableDeclaration> parameterTypes;
    private final List<VariableDeclaration> returnTypes;
    private final Visibility visibility;
    private final String stateMutability;

    public FunctionTypeName(
            List<VariableDeclaration> parameterTypes,
            List<VariableDeclaration> returnTypes,
            Visibility visibility,
            String stateMutability) {
        super(NodeType.FUNCTION_TYPE_NAME);
        this.parameterTypes = List.copyOf(parameterTypes);
        this.returnTypes = List.copyOf(returnTypes);
        this.visibility = Objects.requireNonNull(visibility, "visibility");
        this.stateMutability = stateMutability;
    }

    public List<VariableDeclaration> getParameterTypes() {
        return parameterTypes;
    }

    public List<VariableDeclaration> getReturnTypes() {
        return returnTypes;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public String getStateMutability() {
        return stateMutability;
    }

    @Override
    protected List<Object> components() {
        return fields(parameterTypes, returnTypes, visibility, stateMutability);
    }
}
