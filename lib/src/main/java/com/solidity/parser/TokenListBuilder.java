package com.solidity.parser;

import com.solidity.parser.ast.SourceLocation;
import com.solidity.parser.ast.SourceRange;
import com.solidity.parser.ast.SourceToken;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;

/** Converts the lexer's token stream into the categorized token list attached to a source unit. */
final class TokenListBuilder {
    private static final Pattern WORD = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Set<String> TYPE_WORDS = Set.of("var", "bool", "address", "string", "byte");
    private static final Set<String> TYPE_TOKENS = Set.of("Int", "Uint", "Byte", "Fixed", "Ufixed");

    private final Vocabulary vocabulary;
    private final boolean loc;
    private final boolean range;

    TokenListBuilder(Vocabulary vocabulary, boolean loc, boolean range) {
        this.vocabulary = vocabulary;
        this.loc = loc;
        this.range = range;
    }

    List<SourceToken> build(List<? extends Token> tokens) {
        List<SourceToken> result = new ArrayList<>();
        for (Token token : tokens) {
            if (token.getType() == Token.EOF || token.getChannel() != Token.DEFAULT_CHANNEL) {
                continue;
            }
            result.add(
                    new SourceToken(
                            category(token),
                            token.getText(),
                            range ? NodeMetadata.range(token, token) : null,
                            loc ? NodeMetadata.location(token, token) : null));
        }
        return result;
    }

    String category(Token token) {
        String name = vocabulary.getSymbolicName(token.getType());
        String text = token.getText();
        if (name == null || name.startsWith("T__")) {
            // implicit literal tokens of the grammar
            if (!WORD.matcher(text).matches()) {
                return "Punctuator";
            }
            if (text.equals("from")) {
                return "Identifier";
            }
            return TYPE_WORDS.contains(text) ? "Type" : "Keyword";
        }
        if (TYPE_TOKENS.contains(name)) {
            return "Type";
        }
        switch (name) {
            case "Identifier":
                return "Identifier";
            case "BooleanLiteral":
                return "Boolean";
            case "VersionLiteral":
                return "Version";
            case "StringLiteralFragment":
                return "String";
            case "NumberUnit":
                return "Subdenomination";
            case "DecimalNumber":
                return "Numeric";
            case "HexNumber":
            case "HexLiteralFragment":
                return "Hex";
            default:
                return "Keyword";
        }
    }
}
