package com.vidnyan.trustgate.domain.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Structure-only view of a program graph for visualisation clients.
 */
@JsonPropertyOrder({"graph_type", "nodes", "edges", "entry", "exit"})
public record GraphExport(
    @JsonProperty("graph_type") String graphType,
    List<Node> nodes,
    List<Edge> edges,
    Integer entry,
    Integer exit
) {

    public record Node(int id, String label, int line) {}

    public record Edge(int src, int dst, String label) {}

    /**
     * Strip a graph down to ids, labels and lines.
     */
    public static GraphExport of(ProgramGraph graph) {
        return new GraphExport(
                graph.kind().id(),
                graph.nodes().values().stream()
                        .map(n -> new Node(n.id(), n.label(), n.line()))
                        .toList(),
                graph.edges().stream()
                        .map(e -> new Edge(e.src(), e.dst(), e.label()))
                        .toList(),
                graph.entry().orElse(null),
                graph.exit().orElse(null));
    }
}
