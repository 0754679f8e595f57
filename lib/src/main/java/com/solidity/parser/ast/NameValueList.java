package com.solidity.parser.ast;

import java.util.ArrayList;
import java.util.List;

public final class NameValueList extends AstNode {
    private final List<Identifier> identifiers;
    private final List<Expression> arguments;

    public NameValueList(List<Identifier> identifiers, List<Expression> arguments) {
        super(NodeType.NAME_VALUE_LIST);
        if (identifiers.size() != arguments.size()) {
            throw new IllegalArgumentException("identifiers and arguments must have the same length");
        }
        this.identifiers = List.copyOf(identifiers);
        this.arguments = List.copyOf(arguments);
    }

    public List<String> getNames() {
        List<String> names = new ArrayList<>(identifiers.size());
        for (Identifier identifier : identifiers) {
            names.add(identifier.getName());
        }
        return names;
    }

    public List<Identifier> getIdentifiers() {
        return identifiers;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    protected List<Object> components() {
        return fields(identifiers, arguments);
    }
}
