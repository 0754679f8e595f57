package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class IndexAccess extends AstNode implements Expression {
    private final Expression base;
    private final Expression index;

    public IndexAccess(Expression base, Expression index) {
        super(NodeType.INDEX_ACCESS);
        this.base = Objects.requireNonNull(base, "base");
        this.index = Objects.requireNonNull(index, "index");
    }

    public Expression getBase() {
        return base;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    protected List<Object> components() {
        return fields(base, index);
    }
}
