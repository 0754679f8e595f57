package com.solidity.parser;

import com.solidity.parser.ast.SyntaxDiagnostic;
import java.util.List;

/** Thrown by a strict parse when the lexer or parser reported at least one syntax error. */
public final class SolidityParseException extends Exception {
    private final List<SyntaxDiagnostic> errors;

    public SolidityParseException(List<SyntaxDiagnostic> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    private static String describe(List<SyntaxDiagnostic> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("errors must not be empty");
        }
        return errors.get(0).toString();
    }

    public List<SyntaxDiagnostic> getErrors() {
        return errors;
    }

    public SyntaxDiagnostic getFirstError() {
        return errors.get(0);
    }
}
