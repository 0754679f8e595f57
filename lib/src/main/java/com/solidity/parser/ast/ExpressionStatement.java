package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class ExpressionStatement extends AstNode implements Statement {
    private final Expression expression;

    public ExpressionStatement(Expression expression) {
        super(NodeType.EXPRESSION_STATEMENT);
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    protected List<Object> components() {
        return fields(expression);
    }
}
