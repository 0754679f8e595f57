package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class DecimalNumber extends AstNode implements AssemblyExpression {
    private final String value;

    public DecimalNumber(String value) {
        super(NodeType.DECIMAL_NUMBER);
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    @Override
    protected List<Object> components() {
        return fields(value);
    }
}
