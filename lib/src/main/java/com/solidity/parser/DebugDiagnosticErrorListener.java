package com.solidity.parser;

import java.util.BitSet;
import java.util.Locale;
import org.antlr.v4.runtime.DiagnosticErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.atn.ATNConfigSet;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Records ambiguity reports without turning them into syntax errors.
 *
 * <p>{@link DiagnosticErrorListener} reports through {@link Parser#notifyErrorListeners(String)}, which
 * would land in the collected syntax errors of the parse. Here the messages go to {@link DebugFlags}
 * instead, so tracing never changes the outcome of a parse.</p>
 */
final class DebugDiagnosticErrorListener extends DiagnosticErrorListener {

    DebugDiagnosticErrorListener() {
        super(true);
    }

    @Override
    public void reportAmbiguity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            boolean exact,
            BitSet ambigAlts,
            ATNConfigSet configs) {
        if (exactOnly && !exact) {
            return;
        }
        DebugFlags.captureDiagnostic(
                String.format(
                        Locale.ROOT,
                        "ambiguity in %s: alternatives %s, input '%s'",
                        getDecisionDescription(recognizer, dfa),
                        getConflictingAlts(ambigAlts, configs),
                        text(recognizer, startIndex, stopIndex)));
    }

    @Override
    public void reportAttemptingFullContext(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            BitSet conflictingAlts,
            ATNConfigSet configs) {
        DebugFlags.captureDiagnostic(
                String.format(
                        Locale.ROOT,
                        "full-context prediction in %s, input '%s'",
                        getDecisionDescription(recognizer, dfa),
                        text(recognizer, startIndex, stopIndex)));
    }

    @Override
    public void reportContextSensitivity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            int prediction,
            ATNConfigSet configs) {
        DebugFlags.captureDiagnostic(
                String.format(
                        Locale.ROOT,
                        "context sensitivity in %s, predicted alternative %d, input '%s'",
                        getDecisionDescription(recognizer, dfa),
                        prediction,
                        text(recognizer, startIndex, stopIndex)));
    }

    private static String text(Parser recognizer, int startIndex, int stopIndex) {
        return recognizer.getTokenStream().getText(Interval.of(startIndex, stopIndex));
    }
}
