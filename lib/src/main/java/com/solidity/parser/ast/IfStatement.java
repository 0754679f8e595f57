package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class IfStatement extends AstNode implements Statement {
    private final Expression condition;
    private final Statement trueBody;
    private final Statement falseBody;

    public IfStatement(Expression condition, Statement trueBody, Statement falseBody) {
        super(NodeType.IF_STATEMENT);
        this.condition = Objects.requireNonNull(condition, "condition");
        this.trueBody = Objects.requireNonNull(trueBody, "trueBody");
        this.falseBody = falseBody;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getTrueBody() {
        return trueBody;
    }

    public Statement getFalseBody() {
        return falseBody;
    }

    @Override
    protected List<Object> components() {
        return fields(condition, trueBody, falseBody);
    }
}
