package com.solidity.parser.ast;

import java.util.Locale;

/** Declared visibility. {@link #DEFAULT} means no visibility keyword was written. */
public enum Visibility {
    DEFAULT,
    EXTERNAL,
    INTERNAL,
    PUBLIC,
    PRIVATE;

    public String getKeyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
