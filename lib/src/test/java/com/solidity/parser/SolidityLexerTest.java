package com.solidity.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.solidity.parser.grammar.SolidityLexer;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.junit.jupiter.api.Test;

class SolidityLexerTest {

    private static List<String> tokenNames(String source) {
        SolidityLexer lexer = new SolidityLexer(CharStreams.fromString(source));
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();

        List<String> names = new ArrayList<>();
        for (Token token : tokens.getTokens()) {
            if (token.getType() == Token.EOF) {
                names.add("EOF");
            } else if (token.getChannel() == Token.DEFAULT_CHANNEL) {
                String name = lexer.getVocabulary().getSymbolicName(token.getType());
                names.add(name != null ? name : lexer.getVocabulary().getDisplayName(token.getType()));
            }
        }
        return names;
    }

    @Test
    void versionPragmaUsesVersionLiterals() {
        assertEquals(
                List.of("'pragma'", "Identifier", "'^'", "VersionLiteral", "';'", "EOF"),
                tokenNames("pragma solidity ^0.8.0;"));
    }

    @Test
    void sizedTypesAndNumbers() {
        assertEquals(
                List.of("Uint", "Identifier", "'='", "HexNumber", "';'", "Byte", "Int", "DecimalNumber", "EOF"),
                tokenNames("uint256 x = 0x1F; bytes32 int8 1.5e3"));
    }

    @Test
    void literalFragmentsWinOverIdentifiers() {
        assertEquals(
                List.of("HexLiteralFragment", "StringLiteralFragment", "StringLiteralFragment", "Identifier", "EOF"),
                tokenNames("hex\"00ff\" unicode\"hé\" 'single' hexagon"));
    }

    @Test
    void unitsAndKeywords() {
        assertEquals(
                List.of("DecimalNumber", "NumberUnit", "PayableKeyword", "ReceiveKeyword", "'mapping'", "EOF"),
                tokenNames("1 gwei payable receive mapping"));
    }

    @Test
    void commentsStayOffTheDefaultChannel() {
        assertEquals(
                List.of("Identifier", "Identifier", "EOF"),
                tokenNames("a /* block\n comment */ b // trailing"));
    }
}
