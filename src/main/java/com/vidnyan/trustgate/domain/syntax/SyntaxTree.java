package com.vidnyan.trustgate.domain.syntax;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Concrete syntax tree produced by a {@link Grammar}.
 */
public record SyntaxTree(SyntaxNode root, String source) {

    /**
     * Check whether any node is an ERROR node or a missing token.
     * Uses an explicit stack so deeply nested trees cannot exhaust the call stack.
     */
    public boolean containsErrors() {
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node.isError() || node.isMissing()) {
                return true;
            }
            for (SyntaxNode child : node.children()) {
                stack.push(child);
            }
        }
        return false;
    }
}
