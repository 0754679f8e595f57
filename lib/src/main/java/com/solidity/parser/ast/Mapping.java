package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class Mapping extends AstNode implements TypeName {
    private final TypeName keyType;
    private final Identifier keyName;
    private final TypeName valueType;
    private final Identifier valueName;

    public Mapping(TypeName keyType, Identifier keyName, TypeName valueType, Identifier valueName) {
        super(NodeType.MAPPING);
        this.keyType = Objects.requireNonNull(keyType, "keyType");
        this.keyName = keyName;
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        this.valueName = valueName;
    }

    /** Either an {@link ElementaryTypeName} or a {@link UserDefinedTypeName}. */
    public TypeName getKeyType() {
        return keyType;
    }

    public Identifier getKeyName() {
        return keyName;
    }

    public TypeName getValueType() {
        return valueType;
    }

    public Identifier getValueName() {
        return valueName;
    }

    @Override
    protected List<Object> components() {
        return fields(keyType, keyName, valueType, valueName);
    }
}
