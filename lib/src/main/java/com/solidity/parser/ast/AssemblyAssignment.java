package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class AssemblyAssignment extends AstNode implements AssemblyItem {
    private final List<AssemblyExpression> names;
    private final AssemblyExpression expression;

    public AssemblyAssignment(List<AssemblyExpression> names, AssemblyExpression expression) {
        super(NodeType.ASSEMBLY_ASSIGNMENT);
        this.names = List.copyOf(names);
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public List<AssemblyExpression> getNames() {
        return names;
    }

    public AssemblyExpression getExpression() {
        return expression;
    }

    @Override
    protected List<Object> components() {
        return fields(names, expression);
    }
}
