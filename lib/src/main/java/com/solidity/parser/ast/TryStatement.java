package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class TryStatement extends AstNode implements Statement {
    private final Expression expression;
    private final List<VariableDeclaration> returnParameters;
    private final Block body;
    private final List<CatchClause> catchClauses;

    public TryStatement(
            Expression expression,
            List<VariableDeclaration> returnParameters,
            Block body,
            List<CatchClause> catchClauses) {
        super(NodeType.TRY_STATEMENT);
        this.expression = Objects.requireNonNull(expression, "expression");
        this.returnParameters = copyOrNull(returnParameters);
        this.body = Objects.requireNonNull(body, "body");
        this.catchClauses = List.copyOf(catchClauses);
    }

    public Expression getExpression() {
        return expression;
    }

    public List<VariableDeclaration> getReturnParameters() {
        return returnParameters;
    }

    public Block getBody() {
        return body;
    }

    public List<CatchClause> getCatchClauses() {
        return catchClauses;
    }

    @Override
    protected List<Object> components() {
        return fields(expression, returnParameters, body, catchClauses);
    }
}
