package com.solidity.parser.ast;

import java.util.Optional;

public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    EXPONENT("**"),
    MODULO("%"),
    SHIFT_LEFT("<<"),
    SHIFT_RIGHT(">>"),
    SHIFT_RIGHT_UNSIGNED(">>>"),
    AND("&&"),
    OR("||"),
    BITWISE_AND("&"),
    BITWISE_OR("|"),
    BITWISE_XOR("^"),
    LESS("<"),
    GREATER(">"),
    LESS_OR_EQUAL("<="),
    GREATER_OR_EQUAL(">="),
    EQUAL("=="),
    NOT_EQUAL("!="),
    ASSIGN("="),
    ASSIGN_BITWISE_OR("|="),
    ASSIGN_BITWISE_XOR("^="),
    ASSIGN_BITWISE_AND("&="),
    ASSIGN_SHIFT_LEFT("<<="),
    ASSIGN_SHIFT_RIGHT(">>="),
    ASSIGN_SHIFT_RIGHT_UNSIGNED(">>>="),
    ASSIGN_ADD("+="),
    ASSIGN_SUBTRACT("-="),
    ASSIGN_MULTIPLY("*="),
    ASSIGN_DIVIDE("/="),
    ASSIGN_MODULO("%=");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isAssignment() {
        return symbol.endsWith("=")
                && this != LESS_OR_EQUAL
                && this != GREATER_OR_EQUAL
                && this != EQUAL
                && this != NOT_EQUAL;
    }

    public static Optional<BinaryOperator> fromSymbol(String symbol) {
        for (BinaryOperator operator : values()) {
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
