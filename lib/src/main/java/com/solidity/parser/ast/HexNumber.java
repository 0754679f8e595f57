package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class HexNumber extends AstNode implements AssemblyExpression {
    private final String value;

    public HexNumber(String value) {
        super(NodeType.HEX_NUMBER);
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
