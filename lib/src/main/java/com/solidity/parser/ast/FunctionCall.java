package com.solidity.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Call with positional or named arguments. For named arguments {@link #getIdentifiers()} is parallel to
 * {@link #getArguments()}; for positional ones it is empty.
 */
public final class FunctionCall extends AstNode implements Expression {
    private final Expression expression;
    private final List<Expression> arguments;
    private final List<Identifier> identifiers;

    public FunctionCall(Expression expression, List<Expression> arguments, List<Identifier> identifiers) {
        super(NodeType.FUNCTION_CALL);
        if (!identifiers.isEmpty() && identifiers.size() != arguments.size()) {
            throw new IllegalArgumentException("Named arguments need one identifier per argument");
        }
        this.expression = Objects.requireNonNull(expression, "expression");
        this.arguments = List.copyOf(arguments);
        this.identifiers = List.copyOf(identifiers);
    }

    public Expression getExpression() {
        return expression;
    }

    public List<Expression> getArguments() {
        return arguments;
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

    @Override
    protected List<Object> components() {
        return fields(expression, arguments, identifiers);
    }
}
