package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class UserDefinedTypeName extends AstNode implements TypeName {
    private final String namePath;

    public UserDefinedTypeName(String namePath) {
        super(NodeType.USER_DEFINED_TYPE_NAME);
        this.namePath = Objects.requireNonNull(namePath, "namePath");
    }

    /** Dotted path as written, e.g. {@code Lib.Struct}. */
    public String getNamePath() {
        return namePath;
    }

    @Override
    protected List<Object> components() {
        return fields(namePath);
    }
}
