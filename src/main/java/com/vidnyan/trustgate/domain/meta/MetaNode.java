package com.vidnyan.trustgate.domain.meta;

import com.vidnyan.trustgate.domain.syntax.SyntaxNode;

import java.util.*;

/**
 * Language-agnostic AST node.
 * Owns its children exclusively; the syntax node reference is only used for
 * source-text lookups. Immutable once built.
 */
public final class MetaNode {

    private final NodeKind kind;
    private final String name;
    private final String text;
    private final int line;
    private final int endLine;
    private final int column;
    private final int endColumn;
    private final List<MetaNode> children;
    private final String scope;
    private final TrustLevel trustLevel;
    private final boolean async;
    private final boolean exceptionPoint;
    private final SyntaxNode syntax;

    private MetaNode(Builder builder) {
        this.kind = builder.kind;
        this.name = builder.name;
        this.text = builder.text;
        this.line = builder.line;
        this.endLine = builder.endLine;
        this.column = builder.column;
        this.endColumn = builder.endColumn;
        this.children = List.copyOf(builder.children);
        this.scope = builder.scope;
        this.trustLevel = builder.trustLevel;
        this.async = builder.async;
        this.exceptionPoint = builder.exceptionPoint;
        this.syntax = builder.syntax;
    }

    public static Builder builder(NodeKind kind) {
        return new Builder(kind);
    }

    public NodeKind kind() {
        return kind;
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    /**
     * Name, or the empty string when the node has none.
     */
    public String nameOrEmpty() {
        return name == null ? "" : name;
    }

    public String text() {
        return text;
    }

    /** 1-based start line. */
    public int line() {
        return line;
    }

    public int endLine() {
        return endLine;
    }

    /** 0-based start column. */
    public int column() {
        return column;
    }

    public int endColumn() {
        return endColumn;
    }

    public List<MetaNode> children() {
        return children;
    }

    public String scope() {
        return scope;
    }

    public TrustLevel trustLevel() {
        return trustLevel;
    }

    public boolean isAsync() {
        return async;
    }

    public boolean isExceptionPoint() {
        return exceptionPoint;
    }

    /**
     * Originating syntax node, if the node was built from one.
     */
    public Optional<SyntaxNode> syntax() {
        return Optional.ofNullable(syntax);
    }

    public boolean is(NodeKind expected) {
        return kind == expected;
    }

    /**
     * All nodes of the given kind in this subtree, this node included, in pre-order.
     */
    public List<MetaNode> findAll(NodeKind wanted) {
        List<MetaNode> result = new ArrayList<>();
        for (MetaNode node : preOrder()) {
            if (node.kind == wanted) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * First node of the given kind in pre-order.
     */
    public Optional<MetaNode> findFirst(NodeKind wanted) {
        for (MetaNode node : preOrder()) {
            if (node.kind == wanted) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /**
     * Call nodes inside this subtree.
     */
    public List<MetaNode> calls() {
        return findAll(NodeKind.CALL);
    }

    /**
     * This node and all its descendants in pre-order.
     * Walks with an explicit stack.
     */
    public List<MetaNode> preOrder() {
        List<MetaNode> result = new ArrayList<>();
        Deque<MetaNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            MetaNode node = stack.pop();
            result.add(node);
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return kind + (name != null ? "(" + name + ")" : "") + "@" + line + ":" + column;
    }

    public static class Builder {
        private final NodeKind kind;
        private String name;
        private String text = "";
        private int line;
        private int endLine;
        private int column;
        private int endColumn;
        private final List<MetaNode> children = new ArrayList<>();
        private String scope = MetaAst.MODULE_SCOPE;
        private TrustLevel trustLevel = TrustLevel.UNKNOWN;
        private boolean async;
        private boolean exceptionPoint;
        private SyntaxNode syntax;

        private Builder(NodeKind kind) {
            this.kind = kind;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder text(String text) { this.text = text; return this; }
        public Builder line(int line) { this.line = line; return this; }
        public Builder endLine(int endLine) { this.endLine = endLine; return this; }
        public Builder column(int column) { this.column = column; return this; }
        public Builder endColumn(int endColumn) { this.endColumn = endColumn; return this; }
        public Builder child(MetaNode child) { this.children.add(child); return this; }
        public Builder scope(String scope) { this.scope = scope; return this; }
        public Builder trustLevel(TrustLevel level) { this.trustLevel = level; return this; }
        public Builder async(boolean async) { this.async = async; return this; }
        public Builder exceptionPoint(boolean point) { this.exceptionPoint = point; return this; }
        public Builder syntax(SyntaxNode syntax) { this.syntax = syntax; return this; }

        public MetaNode build() {
            return new MetaNode(this);
        }
    }
}
