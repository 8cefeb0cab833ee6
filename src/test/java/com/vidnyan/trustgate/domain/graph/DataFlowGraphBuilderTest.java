package com.vidnyan.trustgate.domain.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.vidnyan.trustgate.support.TestTrees.javascript;
import static com.vidnyan.trustgate.support.TestTrees.python;
import static org.junit.jupiter.api.Assertions.*;

class DataFlowGraphBuilderTest {

    private final DataFlowGraphBuilder builder = new DataFlowGraphBuilder();

    @Test
    void build_ConnectsDefinitionsToLaterUses() {
        ProgramGraph dfg = builder.build(python("x = 1\ny = x + 2\nprint(y)\n"));

        GraphNode defX = node(dfg, "def:x").orElseThrow();
        GraphNode useX = node(dfg, "use:x").orElseThrow();
        GraphNode defY = node(dfg, "def:y").orElseThrow();
        GraphNode useY = node(dfg, "use:y").orElseThrow();

        assertEquals(1, defX.line());
        assertEquals(2, defY.line());
        assertTrue(hasEdge(dfg, defX, useX, "x"));
        assertTrue(hasEdge(dfg, defY, useY, "y"));
        assertEquals(2, dfg.edgeCount());
        assertTrue(node(dfg, "use:print").isPresent());
    }

    @Test
    void build_UseBeforeDefinitionHasNoEdge() {
        ProgramGraph dfg = builder.build(python("print(z)\nz = 1\n"));

        assertTrue(node(dfg, "def:z").isPresent());
        assertTrue(node(dfg, "use:z").isPresent());
        assertEquals(0, dfg.edgeCount());
    }

    @Test
    void build_ParametersAreDefinitions() {
        ProgramGraph dfg = builder.build(python("def scale(value, factor=2):\n    return value * factor\n"));

        GraphNode value = node(dfg, "param:value").orElseThrow();
        GraphNode factor = node(dfg, "param:factor").orElseThrow();
        assertTrue(hasEdge(dfg, value, node(dfg, "use:value").orElseThrow(), "value"));
        assertTrue(hasEdge(dfg, factor, node(dfg, "use:factor").orElseThrow(), "factor"));
        assertTrue(node(dfg, "use:scale").isEmpty());
        assertTrue(node(dfg, "def:scale").isEmpty());
    }

    @Test
    void build_BranchDefinitionsBothReachUse() {
        ProgramGraph dfg = builder.build(python("if c:\n    v = 1\nelse:\n    v = 2\nprint(v)\n"));

        List<GraphNode> defs = dfg.nodes().values().stream().filter(n -> n.label().equals("def:v")).toList();
        GraphNode use = node(dfg, "use:v").orElseThrow();
        assertEquals(2, defs.size());
        for (GraphNode def : defs) {
            assertTrue(hasEdge(dfg, def, use, "v"));
        }
    }

    @Test
    void build_JavaScriptDeclarationsAndArrowParameter() {
        ProgramGraph dfg = builder.build(javascript("const base = 10;\nconst add = n => n + base;\n"));

        GraphNode base = node(dfg, "def:base").orElseThrow();
        GraphNode n = node(dfg, "param:n").orElseThrow();
        assertTrue(hasEdge(dfg, base, node(dfg, "use:base").orElseThrow(), "base"));
        assertTrue(hasEdge(dfg, n, node(dfg, "use:n").orElseThrow(), "n"));
    }

    private static Optional<GraphNode> node(ProgramGraph graph, String label) {
        return graph.nodes().values().stream().filter(n -> n.label().equals(label)).findFirst();
    }

    private static boolean hasEdge(ProgramGraph graph, GraphNode src, GraphNode dst, String label) {
        return graph.edges().stream()
                .anyMatch(e -> e.src() == src.id() && e.dst() == dst.id() && e.label().equals(label));
    }
}
