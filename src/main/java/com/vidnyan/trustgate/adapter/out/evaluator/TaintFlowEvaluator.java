package com.vidnyan.trustgate.adapter.out.evaluator;

import com.vidnyan.trustgate.domain.graph.GraphEdge;
import com.vidnyan.trustgate.domain.graph.GraphKind;
import com.vidnyan.trustgate.domain.graph.GraphNode;
import com.vidnyan.trustgate.domain.graph.ProgramGraph;
import com.vidnyan.trustgate.domain.rule.EvaluationContext;
import com.vidnyan.trustgate.domain.rule.Finding;
import com.vidnyan.trustgate.domain.rule.RuleEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reports one finding per edge of the taint-flow graph, located at the sink.
 * Without a taint-flow graph the rule has nothing to report.
 */
public class TaintFlowEvaluator implements RuleEvaluator {

    public static final String ID = "taint_flow";

    @Override
    public List<Finding> evaluate(EvaluationContext context) {
        Optional<ProgramGraph> tfg = context.graph(GraphKind.TFG);
        if (tfg.isEmpty()) {
            return List.of();
        }
        ProgramGraph graph = tfg.get();

        List<Finding> findings = new ArrayList<>();
        for (GraphEdge edge : graph.edges()) {
            Optional<GraphNode> source = graph.node(edge.src());
            Optional<GraphNode> sink = graph.node(edge.dst());
            if (source.isEmpty() || sink.isEmpty()) {
                continue;
            }
            Finding.Builder finding = context.finding()
                    .message(String.format("Untrusted data from `%s` (L%d) reaches dangerous sink `%s` (L%d)",
                            source.get().label(), source.get().line(),
                            sink.get().label(), sink.get().line()))
                    .fixHint("Sanitise or validate the input before passing to the sink.");
            sink.get().metaNode().ifPresent(finding::at);
            findings.add(finding.line(sink.get().line()).build());
        }
        return findings;
    }
}
