package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class WhileStatement extends AstNode implements Statement {
    private final Expression condition;
    private final Statement body;

    public WhileStatement(Expression condition, Statement body) {
        super(NodeType.WHILE_STATEMENT);
        this.condition = Objects.requireNonNull(condition, "condition");
        this.body = Objects.requireNonNull(body, "body");
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    protected List<Object> components() {
        return fields(condition, body);
    }
}
