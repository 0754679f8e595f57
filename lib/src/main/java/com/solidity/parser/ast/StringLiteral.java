package com.solidity.parser.ast;

import java.util.List;

/**
 * One or more adjacent string fragments. Each part keeps its escapes except for the escaped
 * delimiter quote; {@link #getValue()} is the concatenation of the parts.
 */
public final class StringLiteral extends AstNode implements Expression, AssemblyExpression {
    private final List<String> parts;
    private final List<Boolean> isUnicode;

    public StringLiteral(List<String> parts, List<Boolean> isUnicode) {
        super(NodeType.STRING_LITERAL);
        if (parts.size() != isUnicode.size()) {
            throw new IllegalArgumentException("parts and isUnicode must have the same length");
        }
        this.parts = List.copyOf(parts);
        this.isUnicode = List.copyOf(isUnicode);
    }

    public static StringLiteral of(String value) {
        return new StringLiteral(List.of(value), List.of(false));
    }

    public String getValue() {
        return String.join("", parts);
    }

    public List<String> getParts() {
        return parts;
    }

    public List<Boolean> getIsUnicode() {
        return isUnicode;
    }

    @Override
    protected List<Object> components() {
        return fields(parts, isUnicode);
    }
}
