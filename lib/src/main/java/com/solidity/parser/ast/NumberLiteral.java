package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class NumberLiteral extends AstNode implements Expression, AssemblyExpression {
    private final String number;
    private final String subdenomination;

    public NumberLiteral(String number, String subdenomination) {
        super(NodeType.NUMBER_LITERAL);
        this.number = Objects.requireNonNull(number, "number");
        this.subdenomination = subdenomination;
    }

    /** Literal text as written, underscores and exponent included. */
    public String getNumber() {
        return number;
    }

    /** Unit such as {@code ether} or {@code days}, or {@code null}. */
    public String getSubdenomination() {
        return subdenomination;
    }

    @Override
    protected List<Object> components() {
        return fields(number, subdenomination);
    }
}
