package com.solidity.parser.ast;

import java.util.List;

public final class VariableDeclarationStatement extends AstNode implements Statement {
    private final List<VariableDeclaration> variables;
    private final Expression initialValue;

    public VariableDeclarationStatement(List<VariableDeclaration> variables, Expression initialValue) {
        super(NodeType.VARIABLE_DECLARATION_STATEMENT);
        this.variables = holeyCopy(variables);
        this.initialValue = initialValue;
    }

    /** Declared variables. Skipped tuple slots, as in {@code (a, , b) = f()}, are {@code null}. */
    public List<VariableDeclaration> getVariables() {
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
