package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class UnaryOperation extends AstNode implements Expression {
    private final UnaryOperator operator;
    private final Expression subExpression;
    private final boolean isPrefix;

    public UnaryOperation(UnaryOperator operator, Expression subExpression, boolean isPrefix) {
        super(NodeType.UNARY_OPERATION);
        this.operator = Objects.requireNonNull(operator, "operator");
        this.subExpression = Objects.requireNonNull(subExpression, "subExpression");
        if (!isPrefix && !operator.isIncrementOrDecrement()) {
            throw new IllegalArgumentException("Only ++ and -- can be postfix, got " + operator);
        }
        this.isPrefix = isPrefix;
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public Expression getSubExpression() {
        return subExpression;
    }

    public boolean isPrefix() {
        return isPrefix;
    }

    @Override
    protected List<Object> components() {
        return fields(operator, subExpression, isPrefix);
    }
}
