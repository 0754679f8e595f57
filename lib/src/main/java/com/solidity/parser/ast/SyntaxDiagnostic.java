package com.solidity.parser.ast;

import java.util.Objects;

/** A recoverable syntax error reported by the lexer or parser. Column is 0-based. */
public final class SyntaxDiagnostic {
    private final String message;
    private final int line;
    private final int column;

    public SyntaxDiagnostic(String message, int line, int column) {
        this.message = Objects.requireNonNull(message, "message");
        this.line = line;
        this.column = column;
    }

    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SyntaxDiagnostic)) {
            return false;
        }
        SyntaxDiagnostic other = (SyntaxDiagnostic) obj;
        return line == other.line && column == other.column && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, line, column);
    }

    @Override
    public String toString() {
        return message + " (" + line + ":" + column + ")";
    }
}
