package com.vidnyan.trustgate.domain.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Node of a concrete syntax tree.
 * Node types follow the tree-sitter naming used by the grammars ("call", "function_definition", ...).
 * Immutable once built.
 */
public final class SyntaxNode {

    public static final String ERROR = "ERROR";

    private final String type;
    private final boolean named;
    private final boolean missing;
    private final int startOffset;
    private final int endOffset;
    private final Point start;
    private final Point end;
    private final List<SyntaxNode> children;
    private final Map<String, SyntaxNode> fields;

    private SyntaxNode(String type, boolean named, boolean missing,
                       int startOffset, int endOffset, Point start, Point end,
                       List<SyntaxNode> children, Map<String, SyntaxNode> fields) {
        this.type = type;
        this.named = named;
        this.missing = missing;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.start = start;
        this.end = end;
        this.children = Collections.unmodifiableList(children);
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    public String type() {
        return type;
    }

    public boolean isNamed() {
        return named;
    }

    public boolean isMissing() {
        return missing;
    }

    public boolean isError() {
        return ERROR.equals(type);
    }

    public int startOffset() {
        return startOffset;
    }

    public int endOffset() {
        return endOffset;
    }

    public Point start() {
        return start;
    }

    public Point end() {
        return end;
    }

    public List<SyntaxNode> children() {
        return children;
    }

    public int childCount() {
        return children.size();
    }

    /**
     * Child registered under a grammar field name ("name", "function", "body", ...).
     */
    public Optional<SyntaxNode> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public Optional<SyntaxNode> firstChild() {
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
    }

    /**
     * Source text covered by this node.
     */
    public String text(String source) {
        int from = Math.min(startOffset, source.length());
        int to = Math.min(endOffset, source.length());
        return source.substring(from, to);
    }

    @Override
    public String toString() {
        return type + "[" + start.row() + ":" + start.column() + "-" + end.row() + ":" + end.column() + "]";
    }

    /**
     * Builds a node. Without an explicit span the node covers its first through last child.
     */
    public static final class Builder {
        private final String type;
        private final List<SyntaxNode> children = new ArrayList<>();
        private final Map<String, SyntaxNode> fields = new LinkedHashMap<>();
        private boolean named = true;
        private boolean missing;
        private boolean spanSet;
        private int startOffset;
        private int endOffset;
        private Point start = Point.ORIGIN;
        private Point end = Point.ORIGIN;

        private Builder(String type) {
            this.type = type;
        }

        public Builder named(boolean named) {
            this.named = named;
            return this;
        }

        public Builder missing(boolean missing) {
            this.missing = missing;
            return this;
        }

        public Builder span(int startOffset, int endOffset, Point start, Point end) {
            this.spanSet = true;
            this.startOffset = startOffset;
            this.endOffset = endOffset;
            this.start = start;
            this.end = end;
            return this;
        }

        public Builder child(SyntaxNode node) {
            if (node != null) {
                children.add(node);
            }
            return this;
        }

        /**
         * Adds a child under a grammar field name; the first child registered for a name wins.
         */
        public Builder field(String name, SyntaxNode node) {
            if (node != null) {
                children.add(node);
                fields.putIfAbsent(name, node);
            }
            return this;
        }

        public SyntaxNode build() {
            if (!spanSet && !children.isEmpty()) {
                SyntaxNode first = children.get(0);
                SyntaxNode last = children.get(children.size() - 1);
                span(first.startOffset, last.endOffset, first.start, last.end);
            }
            return new SyntaxNode(type, named, missing, startOffset, endOffset, start, end,
                    new ArrayList<>(children), new LinkedHashMap<>(fields));
        }
    }
}
