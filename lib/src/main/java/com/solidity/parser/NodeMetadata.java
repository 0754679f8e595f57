package com.solidity.parser;

import com.solidity.parser.ast.AstNode;
import com.solidity.parser.ast.SourceLocation;
import com.solidity.parser.ast.SourceRange;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

/**
 * Computes the location and range of a node from the tokens its parse context spans.
 *
 * <p>The start is the first token of the context and the end is its last token. A context that matched
 * no tokens has a stop token before its start token; such contexts use the start token for both ends.</p>
 */
final class NodeMetadata {
    private final boolean loc;
    private final boolean range;

    NodeMetadata(boolean loc, boolean range) {
        this.loc = loc;
        this.range = range;
    }

    <T extends AstNode> T attach(T node, ParserRuleContext context) {
        if (!loc && !range) {
            return node;
        }
        Token start = context.getStart();
        Token stop = lastToken(context);
        node.attachMetadata(loc ? location(start, stop) : null, range ? range(start, stop) : null);
        return node;
    }

    static SourceLocation location(Token start, Token stop) {
        return new SourceLocation(
                new SourceLocation.Position(start.getLine(), start.getCharPositionInLine()),
                new SourceLocation.Position(stop.getLine(), stop.getCharPositionInLine()));
    }

    static SourceRange range(Token start, Token stop) {
        int offsetStart = start.getStartIndex();
        // EOF of an empty input spans no characters.
        int offsetEnd = Math.max(stop.getStopIndex(), offsetStart);
        return new SourceRange(offsetStart, offsetEnd);
    }

    private static Token lastToken(ParserRuleContext context) {
        Token start = context.getStart();
        Token stop = context.getStop();
        if (stop == null || stop.getTokenIndex() < start.getTokenIndex()) {
            return start;
        }
        return stop;
    }
}
