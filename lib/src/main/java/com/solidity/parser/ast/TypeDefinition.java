package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

/** User defined value type: {@code type Price is uint128;}. */
public final class TypeDefinition extends AstNode implements SourceUnitPart, ContractPart {
    private final String name;
    private final ElementaryTypeName definition;

    public TypeDefinition(String name, ElementaryTypeName definition) {
        super(NodeType.TYPE_DEFINITION);
        this.name = Objects.requireNonNull(name, "name");
        this.definition = Objects.requireNonNull(definition, "definition");
    }

    public String getName() {
        return name;
    }

    public ElementaryTypeName getDefinition() {
        return definition;
    }

    @Override
    protected List<Object> components() {
        return fields(name, definition);
    }
}
