package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class Conditional extends AstNode implements Expression {
    private final Expression condition;
    private final Expression trueExpression;
    private final Expression falseExpression;

    public Conditional(Expression condition, Expression trueExpression, Expression falseExpression) {
        super(NodeType.CONDITIONAL);
        this.condition = Objects.requireNonNull(condition, "condition");
        this.trueExpression = Objects.requireNonNull(trueExpression, "trueExpression");
        this.falseExpression = Objects.requireNonNull(falseExpression, "falseExpression");
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getTrueExpression() {
        return trueExpression;
    }

    public Expression getFalseExpression() {
        return falseExpression;
    }

    @Override
    protected List<Object> components() {
        return fields(condition, trueExpression, falseExpression);
    }
}
