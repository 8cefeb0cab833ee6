package com.vidnyan.trustgate.domain.graph;

import com.vidnyan.trustgate.domain.language.LanguageDefinition;
import com.vidnyan.trustgate.domain.language.LanguageRegistry;
import com.vidnyan.trustgate.domain.language.TaintCatalog;
import com.vidnyan.trustgate.domain.meta.MetaAst;
import com.vidnyan.trustgate.domain.meta.MetaNode;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a taint-flow graph from the calls of a tree.
 * <p>
 * Calls matching the language's taint sources become SOURCE nodes and calls
 * matching its sinks become SINK nodes; a call can be both. A source is
 * connected to a sink when both sit in the same scope and the source does not
 * come after the sink. This is a coarse heuristic, not a dataflow analysis.
 */
@RequiredArgsConstructor
public class TaintFlowGraphBuilder implements GraphBuilder {

    public static final String SOURCE = "SOURCE";
    public static final String SINK = "SINK";
    public static final String TAINT_FLOW = "taint_flow";

    private final LanguageRegistry registry;

    @Override
    public GraphKind kind() {
        return GraphKind.TFG;
    }

    @Override
    public ProgramGraph build(MetaAst ast) {
        TaintCatalog catalog = registry.find(ast.language())
                .map(LanguageDefinition::taintCatalog)
                .orElseGet(TaintCatalog::empty);
        ProgramGraph.Builder tfg = ProgramGraph.builder(GraphKind.TFG);

        List<GraphNode> sources = new ArrayList<>();
        List<GraphNode> sinks = new ArrayList<>();
        for (MetaNode call : ast.allCalls()) {
            String name = call.nameOrEmpty();
            if (catalog.isSource(name)) {
                sources.add(tfg.addNode(SOURCE + ": " + name, call, call.line()));
            }
            if (catalog.isSink(name)) {
                sinks.add(tfg.addNode(SINK + ": " + name, call, call.line()));
            }
        }

        for (GraphNode source : sources) {
            for (GraphNode sink : sinks) {
                if (source.line() <= sink.line() && source.meta().scope().equals(sink.meta().scope())) {
                    tfg.addEdge(source.id(), sink.id(), TAINT_FLOW);
                }
            }
        }
        return tfg.build();
    }
}
