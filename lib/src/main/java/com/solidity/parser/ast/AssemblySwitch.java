package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class AssemblySwitch extends AstNode implements AssemblyItem {
    private final AssemblyExpression expression;
    private final List<AssemblyCase> cases;

    public AssemblySwitch(AssemblyExpression expression, List<AssemblyCase> cases) {
        super(NodeType.ASSEMBLY_SWITCH);
        this.expression = Objects.requireNonNull(expression, "expression");
        this.cases = List.copyOf(cases);
    }

    public AssemblyExpression getExpression() {
        return expression;
    }

    public List<AssemblyCase> getCases() {
        return cases;
    }

    @Override
    protected List<Object> components() {
        return fields(expression, cases);
    }
}
