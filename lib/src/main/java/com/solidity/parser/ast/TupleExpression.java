package com.solidity.parser.ast;

import java.util.List;

/** Parenthesized tuple {@code (a, , b)} or inline array {@code [a, b]}. Tuple holes are {@code null}. */
public final class TupleExpression extends AstNode implements Expression {
    private final List<Expression> components;
    private final boolean isArray;

    public TupleExpression(List<Expression> components, boolean isArray) {
        super(NodeType.TUPLE_EXPRESSION);
        this.components = holeyCopy(components);
        this.isArray = isArray;
    }

    public List<Expression> getComponents() {
        return components;
    }

    public boolean isArray() {
        return isArray;
    }

    @Override
    protected List<Object> components() {
        return fields(components, isArray);
    }
}
