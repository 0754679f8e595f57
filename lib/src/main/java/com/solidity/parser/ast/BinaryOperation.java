package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class BinaryOperation extends AstNode implements Expression {
    private final BinaryOperator operator;
    private final Expression left;
    private final Expression right;

    public BinaryOperation(BinaryOperator operator, Expression left, Expression right) {
        super(NodeType.BINARY_OPERATION);
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    protected List<Object> components() {
        return fields(operator, left, right);
    }
}
