package com.vidnyan.trustgate.domain.graph;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The four program graphs derived from a Meta-AST.
 */
public enum GraphKind {
    CFG("cfg"),
    DFG("dfg"),
    TFG("tfg"),
    CALL_GRAPH("call_graph");

    private final String id;

    GraphKind(String id) {
        this.id = id;
    }

    /**
     * Get the external id ("cfg", "call_graph", ...).
     */
    public String id() {
        return id;
    }

    public static Optional<GraphKind> fromId(String id) {
        return Arrays.stream(values()).filter(k -> k.id.equals(id)).findFirst();
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(GraphKind::id).toList();
    }
}
