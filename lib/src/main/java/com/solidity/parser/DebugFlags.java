package com.solidity.parser;

import com.solidity.parser.grammar.SolidityLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;

/**
 * Switches for the token dump and the parser diagnostics. Both are read from system properties first
 * and fall back to environment variables. Captured output is kept per thread so tests can inspect it.
 */
public final class DebugFlags {
    private static final Logger LOGGER = Logger.getLogger(DebugFlags.class.getName());

    static final String TOKENS_PROPERTY = "solidity.parser.debugTokens";
    static final String PARSER_PROPERTY = "solidity.parser.debugParser";
    private static final String TOKENS_ENV = "SOLIDITY_PARSER_DEBUG_TOKENS";
    private static final String PARSER_ENV = "SOLIDITY_PARSER_DEBUG_PARSER";
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS =
            ThreadLocal.withInitial(ArrayList::new);
    private static final ThreadLocal<List<String>> CAPTURED_DIAGNOSTICS =
            ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        return isEnabled(TOKENS_PROPERTY, TOKENS_ENV);
    }

    public static boolean isParserTraceEnabled() {
        return isEnabled(PARSER_PROPERTY, PARSER_ENV);
    }

    private static boolean isEnabled(String property, String environment) {
        String value = System.getProperty(property);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(environment));
    }

    static void logTokens(CommonTokenStream tokens, SolidityLexer lexer) {
        Vocabulary vocabulary = lexer.getVocabulary();
        List<String> lines = CAPTURED_TOKENS.get();
        int first = lines.size();
        for (Token token : tokens.getTokens()) {
            lines.add(describe(token, vocabulary));
        }
        LOGGER.info(
                "Token dump:" + System.lineSeparator() + "  "
                        + String.join(System.lineSeparator() + "  ", lines.subList(first, lines.size())));
    }

    private static String describe(Token token, Vocabulary vocabulary) {
        String name = vocabulary.getSymbolicName(token.getType());
        return String.format(
                Locale.ROOT,
                "%-25s @ %4d:%-3d -> %s",
                name != null ? name : vocabulary.getDisplayName(token.getType()),
                token.getLine(),
                token.getCharPositionInLine(),
                token.getText());
    }

    static DebugDiagnosticErrorListener diagnosticListener() {
        return new DebugDiagnosticErrorListener();
    }

    /** Returns and forgets the token lines dumped on this thread. */
    public static List<String> drainCapturedTokens() {
        return drain(CAPTURED_TOKENS);
    }

    static void captureDiagnostic(String message) {
        LOGGER.fine(message);
        CAPTURED_DIAGNOSTICS.get().add(message);
    }

    /** Returns and forgets the ambiguity reports recorded on this thread. */
    public static List<String> drainCapturedDiagnostics() {
        return drain(CAPTURED_DIAGNOSTICS);
    }

    private static List<String> drain(ThreadLocal<List<String>> capture) {
        List<String> captured = List.copyOf(capture.get());
        capture.remove();
        return captured;
    }
}
