package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class PragmaDirective extends AstNode implements SourceUnitPart {
    private final String name;
    private final String value;

    public PragmaDirective(String name, String value) {
        super(NodeType.PRAGMA_DIRECTIVE);
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getName() {
        return name;
    }

    /** Pragma value with version constraints separated by single spaces, e.g. {@code >=0.5.0 <0.7.0}. */
    public String getValue() {
        return value;
    }

    @Override
    protected List<Object> components() {
        return fields(name, value);
    }
}
