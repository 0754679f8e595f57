package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

/** {@code for (init; condition; loop) body}. The three header parts are each optional. */
public final class ForStatement extends AstNode implements Statement {
    private final Statement initExpression;
    private final Expression conditionExpression;
    private final ExpressionStatement loopExpression;
    private final Statement body;

    public ForStatement(
            Statement initExpression,
            Expression conditionExpression,
            ExpressionStatement loopExpression,
            Statement body) {
        super(NodeType.FOR_STATEMENT);
        this.initExpression = initExpression;
        this.conditionExpression = conditionExpression;
        this.loopExpression = loopExpression;
        this.body = Objects.requireNonNull(body, "body");
    }

    /** A {@link VariableDeclarationStatement} or {@link ExpressionStatement}, or {@code null}. */
    public Statement getInitExpression() {
        return initExpression;
    }

    public Expression getConditionExpression() {
        return conditionExpression;
    }

    public ExpressionStatement getLoopExpression() {
        return loopExpression;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    protected List<Object> components() {
        return fields(initExpression, conditionExpression, loopExpression, body);
    }
}
