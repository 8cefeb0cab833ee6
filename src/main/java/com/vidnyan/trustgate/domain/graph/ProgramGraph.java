package com.vidnyan.trustgate.domain.graph;

import com.vidnyan.trustgate.domain.meta.MetaNode;

import java.util.*;

/**
 * Directed graph over Meta-AST nodes.
 * Node ids are assigned in insertion order and never reused.
 * Immutable and thread-safe once built.
 */
public final class ProgramGraph {

    private final GraphKind kind;
    private final Map<Integer, GraphNode> nodes;
    private final List<GraphEdge> edges;
    private final Map<Integer, List<GraphEdge>> outgoing;
    private final Map<Integer, List<GraphEdge>> incoming;
    private final Integer entry;
    private final Integer exit;

    private ProgramGraph(Builder builder) {
        this.kind = builder.kind;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
        this.edges = List.copyOf(builder.edges);
        Map<Integer, List<GraphEdge>> out = new HashMap<>();
        Map<Integer, List<GraphEdge>> in = new HashMap<>();
        for (GraphEdge edge : edges) {
            out.computeIfAbsent(edge.src(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.dst(), k -> new ArrayList<>()).add(edge);
        }
        this.outgoing = Collections.unmodifiableMap(out);
        this.incoming = Collections.unmodifiableMap(in);
        this.entry = builder.entry;
        this.exit = builder.exit;
    }

    public static Builder builder(GraphKind kind) {
        return new Builder(kind);
    }

    public GraphKind kind() {
        return kind;
    }

    /**
     * Get nodes keyed by id, in insertion order.
     */
    public Map<Integer, GraphNode> nodes() {
        return nodes;
    }

    public Optional<GraphNode> node(int id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public List<GraphEdge> edges() {
        return edges;
    }

    public Optional<Integer> entry() {
        return Optional.ofNullable(entry);
    }

    public Optional<Integer> exit() {
        return Optional.ofNullable(exit);
    }

    /**
     * Get successor ids, one per outgoing edge.
     */
    public List<Integer> successors(int id) {
        return outgoing.getOrDefault(id, List.of()).stream().map(GraphEdge::dst).toList();
    }

    /**
     * Get predecessor ids, one per incoming edge.
     */
    public List<Integer> predecessors(int id) {
        return incoming.getOrDefault(id, List.of()).stream().map(GraphEdge::src).toList();
    }

    /**
     * Find all node ids reachable from a start node, the start included.
     */
    public Set<Integer> reachableFrom(int start) {
        Set<Integer> visited = new LinkedHashSet<>();
        Queue<Integer> queue = new ArrayDeque<>();
        queue.add(start);

        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            for (int next : successors(current)) {
                if (!visited.contains(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    @Override
    public String toString() {
        return kind.id() + "[" + nodes.size() + " nodes, " + edges.size() + " edges]";
    }

    public static class Builder {
        private final GraphKind kind;
        private final Map<Integer, GraphNode> nodes = new LinkedHashMap<>();
        private final List<GraphEdge> edges = new ArrayList<>();
        private int nextId;
        private Integer entry;
        private Integer exit;

        private Builder(GraphKind kind) {
            this.kind = kind;
        }

        /**
         * Add a node with the next free id.
         */
        public GraphNode addNode(String label, MetaNode meta, int line) {
            GraphNode node = new GraphNode(nextId++, label, meta, line);
            nodes.put(node.id(), node);
            return node;
        }

        public GraphEdge addEdge(int src, int dst, String label) {
            return addEdge(src, dst, label, Map.of());
        }

        public GraphEdge addEdge(int src, int dst, String label, Map<String, Object> extra) {
            if (!nodes.containsKey(src) || !nodes.containsKey(dst)) {
                throw new IllegalArgumentException("Edge " + src + " -> " + dst + " references an unknown node");
            }
            GraphEdge edge = new GraphEdge(src, dst, label, extra);
            edges.add(edge);
            return edge;
        }

        public Builder entry(int id) { this.entry = id; return this; }
        public Builder exit(int id) { this.exit = id; return this; }

        /**
         * Get the edges added so far.
         */
        public List<GraphEdge> edges() {
            return Collections.unmodifiableList(edges);
        }

        public Collection<GraphNode> nodes() {
            return Collections.unmodifiableCollection(nodes.values());
        }

        public ProgramGraph build() {
            return new ProgramGraph(this);
        }
    }
}
