package com.vidnyan.trustgate.domain.rule;

import com.vidnyan.trustgate.domain.graph.GraphKind;
import com.vidnyan.trustgate.domain.graph.ProgramGraph;
import com.vidnyan.trustgate.domain.meta.MetaAst;

import java.util.Map;
import java.util.Optional;

/**
 * Everything a rule may look at.
 * A graph whose builder failed is absent from {@code graphs}.
 */
public record EvaluationContext(
    Rule rule,
    MetaAst ast,
    Map<GraphKind, ProgramGraph> graphs
) {

    public static EvaluationContext of(Rule rule, MetaAst ast, Map<GraphKind, ProgramGraph> graphs) {
        return new EvaluationContext(rule, ast, graphs);
    }

    public Optional<ProgramGraph> graph(GraphKind kind) {
        return Optional.ofNullable(graphs.get(kind));
    }

    /**
     * Start a finding carrying this rule's id and default severity.
     */
    public Finding.Builder finding() {
        return Finding.builder()
                .ruleId(rule.id())
                .severity(rule.severity());
    }
}
