package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

/** Legacy {@code expr =: name}. */
public final class AssemblyStackAssignment extends AstNode implements AssemblyItem {
    private final String name;
    private final AssemblyExpression expression;

    public AssemblyStackAssignment(String name, AssemblyExpression expression) {
        super(NodeType.ASSEMBLY_STACK_ASSIGNMENT);
        this.name = Objects.requireNonNull(name, "name");
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public String getName() {
        return name;
    }

    public AssemblyExpression getExpression() {
        return expression;
    }

    @Override
    protected List<Object> components() {
        return fields(name, expression);
    }
}
