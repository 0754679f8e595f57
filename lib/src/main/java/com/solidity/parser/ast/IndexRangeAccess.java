package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

/** Slice {@code base[start:end]}; either bound may be omitted. */
public final class IndexRangeAccess extends AstNode implements Expression {
    private final Expression base;
    private final Expression indexStart;
    private final Expression indexEnd;

    public IndexRangeAccess(Expression base, Expression indexStart, Expression indexEnd) {
        super(NodeType.INDEX_RANGE_ACCESS);
        this.base = Objects.requireNonNull(base, "base");
        this.indexStart = indexStart;
        this.indexEnd = indexEnd;
    }

    public Expression getBase() {
        return base;
    }

    public Expression getIndexStart() {
        return indexStart;
    }

    public Expression getIndexEnd() {
        return indexEnd;
    }

    @Override
    protected List<Object> components() {
        return fields(base, indexStart, indexEnd);
    }
}
