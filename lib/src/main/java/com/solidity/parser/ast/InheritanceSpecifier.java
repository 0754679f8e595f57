package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class InheritanceSpecifier extends AstNode {
    private final UserDefinedTypeName baseName;
    private final List<Expression> arguments;

    public InheritanceSpecifier(UserDefinedTypeName baseName, List<Expression> arguments) {
        super(NodeType.INHERITANCE_SPECIFIER);
        this.baseName = Objects.requireNonNull(baseName, "baseName");
        this.arguments = List.copyOf(arguments);
    }

    public UserDefinedTypeName getBaseName() {
        return baseName;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    protected List<Object> components() {
        return fields(baseName, arguments);
    }
}
