package com.solidity.parser.ast;

import java.util.List;

public final class ReturnStatement extends AstNode implements Statement {
    private final Expression expression;

    public ReturnStatement(Expression expression) {
        super(NodeType.RETURN_STATEMENT);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    protected List<Object> components() {
        return fields(expression);
    }
}
