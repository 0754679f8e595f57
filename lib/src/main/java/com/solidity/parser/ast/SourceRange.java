package com.solidity.parser.ast;

import java.util.Objects;

/** Inclusive character offsets of a node's first and last character in the input. */
public final class SourceRange {
    private final int offsetStart;
    private final int offsetEnd;

    public SourceRange(int offsetStart, int offsetEnd) {
        this.offsetStart = offsetStart;
        this.offsetEnd = offsetEnd;
    }

    public int getOffsetStart() {
        return offsetStart;
    }

    public int getOffsetEnd() {
        return offsetEnd;
    }

    public boolean encloses(SourceRange other) {
        return offsetStart <= other.offsetStart && other.offsetEnd <= offsetEnd;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourceRange)) {
            return false;
        }
        SourceRange other = (SourceRange) obj;
        return offsetStart == other.offsetStart && offsetEnd == other.offsetEnd;
    }

    @Override
    public int hashCode() {
        return Objects.hash(offsetStart, offsetEnd);
    }

    @Override
    public String toString() {
        return "[" + offsetStart + ", " + offsetEnd + "]";
    }
}
