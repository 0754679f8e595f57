package com.solidity.parser.ast;

import java.util.List;

public final class BooleanLiteral extends AstNode implements Expression, AssemblyExpression {
    private final boolean value;

    public BooleanLiteral(boolean value) {
        super(NodeType.BOOLEAN_LITERAL);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    protected List<Object> components() {
        return fields(value);
    }
}
