package com.solidity.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;

/** Tells whether ANTLR error recovery touched a subtree. */
final class SyntaxDamage {

    private SyntaxDamage() {}

    static boolean isDamaged(ParseTree tree) {
        Deque<ParseTree> pending = new ArrayDeque<>();
        pending.push(tree);
        while (!pending.isEmpty()) {
            ParseTree current = pending.pop();
            if (current instanceof ErrorNode) {
                return true;
            }
            if (current instanceof ParserRuleContext context && context.exception != null) {
                return true;
            }
            for (int i = 0; i < current.getChildCount(); i++) {
                pending.push(current.getChild(i));
            }
        }
        return false;
    }
}
