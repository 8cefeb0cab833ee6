package com.vidnyan.trustgate.domain.graph;

import java.util.Map;

/**
 * Directed edge between two graph nodes.
 */
public record GraphEdge(
    int src,
    int dst,
    String label,
    Map<String, Object> extra
) {

    public GraphEdge {
        label = label == null ? "" : label;
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }
}
