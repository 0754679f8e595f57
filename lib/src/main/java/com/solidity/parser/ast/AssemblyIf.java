package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class AssemblyIf extends AstNode implements AssemblyItem {
    private final AssemblyExpression condition;
    private final AssemblyBlock body;

    public AssemblyIf(AssemblyExpression condition, AssemblyBlock body) {
        super(NodeType.ASSEMBLY_IF);
        this.condition = Objects.requireNonNull(condition, "condition");
        this.body = Objects.requireNonNull(body, "body");
    }

    public AssemblyExpression getCondition() {
        return condition;
    }

    public AssemblyBlock getBody() {
        return body;
    }

    @Override
    protected List<Object> components() {
        return fields(condition, body);
    }
}
