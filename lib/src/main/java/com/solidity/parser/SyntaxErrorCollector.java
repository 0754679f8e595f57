package com.solidity.parser;

import com.solidity.parser.ast.SyntaxDiagnostic;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/** Records lexer and parser errors and lets the parse continue with ANTLR's default recovery. */
final class SyntaxErrorCollector extends BaseErrorListener {
    private final List<SyntaxDiagnostic> errors = new ArrayList<>();

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        errors.add(new SyntaxDiagnostic(msg, line, charPositionInLine));
    }

    boolean hasErrors() {
        return !errors.isEmpty();
    }

    List<SyntaxDiagnostic> getErrors() {
        return List.copyOf(errors);
    }
}
