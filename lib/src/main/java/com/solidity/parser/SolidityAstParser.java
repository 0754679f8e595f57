package com.solidity.parser;

import com.solidity.parser.ast.AstNodes;
import com.solidity.parser.ast.SourceUnit;
import com.solidity.parser.grammar.SolidityLexer;
import com.solidity.parser.grammar.SolidityParser;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;

/**
 * Parses Solidity source into a {@link SourceUnit}.
 *
 * <p>Each call builds its own lexer, parser and reducer, so one instance can be shared between
 * threads.</p>
 */
public final class SolidityAstParser {
    private static final Logger LOGGER = Logger.getLogger(SolidityAstParser.class.getName());

    public SourceUnit parse(String source) throws SolidityParseException {
        return parse(source, ParseOptions.defaults());
    }

    /**
     * Parses one compilation unit.
     *
     * @throws SolidityParseException when {@code options} is not tolerant and the input has syntax errors
     * @throws ReductionException when the parse tree cannot be reduced or nests too deeply
     */
    public SourceUnit parse(String source, ParseOptions options) throws SolidityParseException {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(options, "options");
        CharStream input = CharStreams.fromString(source);

        SyntaxErrorCollector errors = new SyntaxErrorCollector();
        SolidityLexer lexer = new SolidityLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        if (DebugFlags.isTokenDebugEnabled()) {
            tokens.fill();
            DebugFlags.logTokens(tokens, lexer);
            tokens.seek(0);
        }

        SolidityParser parser = new SolidityParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errors);
        if (DebugFlags.isParserTraceEnabled()) {
            parser.addErrorListener(DebugFlags.diagnosticListener());
        }

        SolidityParser.SourceUnitContext context;
        try {
            context = parser.sourceUnit();
        } catch (StackOverflowError ex) {
            throw tooDeep(ex);
        }
        if (errors.hasErrors() && !options.isTolerant()) {
            throw new SolidityParseException(errors.getErrors());
        }

        AstReducer reducer =
                new AstReducer(new NodeMetadata(options.isLoc(), options.isRange()), options.getMaxDepth());
        SourceUnit unit;
        try {
            unit = reducer.reduceSourceUnit(context);
        } catch (StackOverflowError ex) {
            throw tooDeep(ex);
        }
        if (errors.hasErrors()) {
            unit.attachErrors(errors.getErrors());
        }
        if (options.isTokens()) {
            tokens.fill();
            TokenListBuilder builder =
                    new TokenListBuilder(lexer.getVocabulary(), options.isLoc(), options.isRange());
            unit.attachTokens(builder.build(tokens.getTokens()));
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(
                    String.format(
                            "Parsed %d top-level parts, %d nodes, %d syntax errors with %s",
                            unit.getChildren().size(),
                            AstNodes.countNodes(unit),
                            unit.getErrors().size(),
                            options));
        }
        return unit;
    }

    // Nesting the call stack cannot hold, reached before the configured maxDepth.
    private static ReductionException tooDeep(StackOverflowError cause) {
        return new ReductionException("Nesting exceeds what the parser can handle", cause);
    }
}
