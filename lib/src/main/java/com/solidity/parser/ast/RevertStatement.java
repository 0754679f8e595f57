package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class RevertStatement extends AstNode implements Statement {
    private final FunctionCall revertCall;

    public RevertStatement(FunctionCall revertCall) {
        super(NodeType.REVERT_STATEMENT);
        this.revertCall = Objects.requireNonNull(revertCall, "revertCall");
    }

    public FunctionCall getRevertCall() {
        return revertCall;
    }

    @Override
    protected List<Object> components() {
        return fields(revertCall);
    }
}
