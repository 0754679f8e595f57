package com.solidity.parser.ast;

import java.util.List;

/** {@code let a, b := expr}. Names are {@link Identifier} or {@link AssemblyMemberAccess} nodes. */
public final class AssemblyLocalDefinition extends AstNode implements AssemblyItem {
    private final List<AssemblyExpression> names;
    private final AssemblyExpression expression;

    public AssemblyLocalDefinition(List<AssemblyExpression> names, AssemblyExpression expression) {
        super(NodeType.ASSEMBLY_LOCAL_DEFINITION);
        this.names = List.copyOf(names);
        this.expression = expression;
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
