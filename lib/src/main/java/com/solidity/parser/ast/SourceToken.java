package com.solidity.parser.ast;

import java.util.Objects;

/** One lexical token of the input, as returned when token output is requested. */
public final class SourceToken {
    private final String type;
    private final String value;
    private final SourceRange range;
    private final SourceLocation location;

    public SourceToken(String type, String value, SourceRange range, SourceLocation location) {
        this.type = Objects.requireNonNull(type, "type");
        this.value = Objects.requireNonNull(value, "value");
        this.range = range;
        this.location = location;
    }

    /** Token category such as {@code Keyword}, {@code Identifier} or {@code Punctuator}. */
    public String getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public SourceRange getRange() {
        return range;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourceToken)) {
            return false;
        }
        SourceToken other = (SourceToken) obj;
        return type.equals(other.type)
                && value.equals(other.value)
                && Objects.equals(range, other.range)
                && Objects.equals(location, other.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, range, location);
    }

    @Override
    public String toString() {
        return type + " '" + value + "'";
    }
}
