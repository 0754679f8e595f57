package com.solidity.parser.ast;

import java.util.Locale;

public enum ContractKind {
    CONTRACT,
    INTERFACE,
    LIBRARY;

    public String getKeyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
