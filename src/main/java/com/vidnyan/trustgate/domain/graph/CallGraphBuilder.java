package com.vidnyan.trustgate.domain.graph;

import com.vidnyan.trustgate.domain.meta.MetaAst;
import com.vidnyan.trustgate.domain.meta.MetaNode;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a call graph with one node per named function.
 * A call whose last dotted segment names a known function becomes a
 * {@code calls} edge from the enclosing function. When several functions share
 * a name, the last definition wins the lookup. Each function is visited once,
 * so recursion needs no special handling.
 */
public class CallGraphBuilder implements GraphBuilder {

    public static final String CALLS = "calls";

    @Override
    public GraphKind kind() {
        return GraphKind.CALL_GRAPH;
    }

    @Override
    public ProgramGraph build(MetaAst ast) {
        ProgramGraph.Builder graph = ProgramGraph.builder(GraphKind.CALL_GRAPH);
        List<MetaNode> functions = ast.allFunctions();

        Map<String, GraphNode> byName = new HashMap<>();
        for (MetaNode function : functions) {
            function.name().filter(n -> !n.isEmpty())
                    .ifPresent(name -> byName.put(name, graph.addNode(name, function, function.line())));
        }

        for (MetaNode function : functions) {
            GraphNode caller = byName.get(function.nameOrEmpty());
            if (caller == null) {
                continue;
            }
            for (MetaNode call : function.calls()) {
                GraphNode callee = byName.get(simpleName(call.nameOrEmpty()));
                if (callee != null) {
                    graph.addEdge(caller.id(), callee.id(), CALLS);
                }
            }
        }
        return graph.build();
    }

    static String simpleName(String callName) {
        int dot = callName.lastIndexOf('.');
        return dot < 0 ? callName : callName.substring(dot + 1);
    }
}
