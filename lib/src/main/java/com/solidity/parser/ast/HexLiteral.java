package com.solidity.parser.ast;

import java.util.List;

public final class HexLiteral extends AstNode implements Expression, AssemblyExpression {
    private final List<String> parts;

    public HexLiteral(List<String> parts) {
        super(NodeType.HEX_LITERAL);
        this.parts = List.copyOf(parts);
    }

    /** Hex digits of all fragments, concatenated. */
    public String getValue() {
        return String.join("", parts);
    }

    /** Hex digits of each {@code hex"..."} fragment without prefix and quotes. */
    public List<String> getParts() {
        return parts;
    }

    @Override
    protected List<Object> components() {
        return fields(parts);
    }
}
