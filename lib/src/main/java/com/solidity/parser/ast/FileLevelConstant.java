package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

/** A {@code constant} declared outside any contract. */
public final class FileLevelConstant extends AstNode implements SourceUnitPart {
    private final TypeName typeName;
    private final String name;
    private final Expression initialValue;

    public FileLevelConstant(TypeName typeName, String name, Expression initialValue) {
        super(NodeType.FILE_LEVEL_CONSTANT);
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.name = Objects.requireNonNull(name, "name");
        this.initialValue = Objects.requireNonNull(initialValue, "initialValue");
    }

    public TypeName getTypeName() {
        return typeName;
    }

    public String getName() {
        return name;
    }

    public Expression getInitialValue() {
        return initialValue;
    }

    public boolean isDeclaredConst() {
        return true;
    }

    public boolean isImmutable() {
        return false;
    }

    @Override
    protected List<Object> components() {
        return fields(typeName, name, initialValue);
    }
}
