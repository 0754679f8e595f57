package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class CatchClause extends AstNode {
    private final String kind;
    private final List<VariableDeclaration> parameters;
    private final Block body;

    public CatchClause(String kind, List<VariableDeclaration> parameters, Block body) {
        super(NodeType.CATCH_CLAUSE);
        this.kind = kind;
        this.parameters = copyOrNull(parameters);
        this.body = Objects.requireNonNull(body, "body");
    }

    /** {@code Error}, {@code Panic}, or {@code null} for a catch-all clause. */
    public String getKind() {
        return kind;
    }

    public boolean isReasonStringType() {
        return "Error".equals(kind);
    }

    public List<VariableDeclaration> getParameters() {
        return parameters;
    }

    public Block getBody() {
        return body;
    }

    @Override
    protected List<Object> components() {
        return fields(kind, parameters, body);
    }
}
