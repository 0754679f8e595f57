package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class ArrayTypeName extends AstNode implements TypeName {
    private final TypeName baseTypeName;
    private final Expression length;

    public ArrayTypeName(TypeName baseTypeName, Expression length) {
        super(NodeType.ARRAY_TYPE_NAME);
        this.baseTypeName = Objects.requireNonNull(baseTypeName, "baseTypeName");
        this.length = length;
    }

    public TypeName getBaseTypeName() {
        return baseTypeName;
    }

    /** Fixed length, or {@code null} for a dynamic array. */
    public Expression getLength() {
        return length;
    }

    @Override
    protected List<Object> components() {
        return fields(baseTypeName, length);
    }
}
