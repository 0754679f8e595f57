package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class EmitStatement extends AstNode implements Statement {
    private final FunctionCall eventCall;

    public EmitStatement(FunctionCall eventCall) {
        super(NodeType.EMIT_STATEMENT);
        this.eventCall = Objects.requireNonNull(eventCall, "eventCall");
    }

    public FunctionCall getEventCall() {
        return eventCall;
    }

    @Override
    protected List<Object> components() {
        return fields(eventCall);
    }
}
