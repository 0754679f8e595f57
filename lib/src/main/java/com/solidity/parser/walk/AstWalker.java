package com.solidity.parser.walk;

import com.solidity.parser.ast.AstNode;
import java.util.Objects;

/** Depth-first traversal that calls enter callbacks before and exit callbacks after a node's children. */
public final class AstWalker {
    private final NodeCallbacks callbacks;

    public AstWalker(NodeCallbacks callbacks) {
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
    }

    public void walk(AstNode root) {
        visit(Objects.requireNonNull(root, "root"), null);
    }

    private void visit(AstNode node, AstNode parent) {
        boolean descend = true;
        for (NodeCallbacks.Enter enter : callbacks.enterCallbacks(node.getType())) {
            descend &= enter.enter(node, parent);
        }
        if (!descend) {
            return;
        }
        for (AstNode child : node.getChildNodes()) {
            visit(child, node);
        }
        for (NodeCallbacks.Exit exit : callbacks.exitCallbacks(node.getType())) {
            exit.exit(node, parent);
        }
    }
}
