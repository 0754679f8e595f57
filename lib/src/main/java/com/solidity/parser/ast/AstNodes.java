package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class AstNodes {

    private AstNodes() {}

    /**
     * Compares the location and range of every node pair in two trees. The trees are walked in
     * lock-step, so callers should first check structural equality with {@link AstNode#equals}.
     */
    public static boolean metadataEquals(AstNode left, AstNode right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (!Objects.equals(left.getLocation(), right.getLocation())
                || !Objects.equals(left.getRange(), right.getRange())) {
            return false;
        }
        List<AstNode> leftChildren = left.getChildNodes();
        List<AstNode> rightChildren = right.getChildNodes();
        if (leftChildren.size() != rightChildren.size()) {
            return false;
        }
        for (int i = 0; i < leftChildren.size(); i++) {
            if (!metadataEquals(leftChildren.get(i), rightChildren.get(i))) {
                return false;
            }
        }
        return true;
    }

    /** Number of nodes in the tree rooted at {@code root}, the root included. */
    public static int countNodes(AstNode root) {
        int count = 1;
        for (AstNode child : root.getChildNodes()) {
            count += countNodes(child);
        }
        return count;
    }
}
