package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class ModifierInvocation extends AstNode {
    private final String name;
    private final List<Expression> arguments;

    public ModifierInvocation(String name, List<Expression> arguments) {
        super(NodeType.MODIFIER_INVOCATION);
        this.name = Objects.requireNonNull(name, "name");
        this.arguments = copyOrNull(arguments);
    }

    public String getName() {
        return name;
    }

    /**
     * Call arguments. Empty when the modifier is named without parentheses, {@code null} when it is
     * written with an empty argument list, as in {@code onlyOwner()}.
     */
    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    protected List<Object> components() {
        return fields(name, arguments);
    }
}
