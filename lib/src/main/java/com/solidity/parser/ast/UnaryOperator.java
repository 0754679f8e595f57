package com.solidity.parser.ast;

import java.util.Optional;

public enum UnaryOperator {
    MINUS("-"),
    PLUS("+"),
    INCREMENT("++"),
    DECREMENT("--"),
    BITWISE_NOT("~"),
    AFTER("after"),
    DELETE("delete"),
    NOT("!");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isIncrementOrDecrement() {
        return this == INCREMENT || this == DECREMENT;
    }

    public static Optional<UnaryOperator> fromSymbol(String symbol) {
        for (UnaryOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
