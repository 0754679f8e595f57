package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

/** Call options such as {@code target.call{value: 1, gas: 2}}. */
public final class NameValueExpression extends AstNode implements Expression {
    private final Expression expression;
    private final NameValueList arguments;

    public NameValueExpression(Expression expression, NameValueList arguments) {
        super(NodeType.NAME_VALUE_EXPRESSION);
        this.expression = Objects.requireNonNull(expression, "expression");
        this.arguments = Objects.requireNonNull(arguments, "arguments");
    }

    public Expression getExpression() {
        return expression;
    }

    public NameValueList getArguments() {
        return arguments;
    }

    @Override
    protected List<Object> components() {
        return fields(expression, arguments);
    }
}
