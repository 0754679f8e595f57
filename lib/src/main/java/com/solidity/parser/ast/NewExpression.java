package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class NewExpression extends AstNode implements Expression {
    private final TypeName typeName;

    public NewExpression(TypeName typeName) {
        super(NodeType.NEW_EXPRESSION);
        this.typeName = Objects.requireNonNull(typeName, "typeName");
    }

    public TypeName getTypeName() {
        return typeName;
    }

    @Override
    protected List<Object> components() {
        return fields(typeName);
    }
}
