package com.vidnyan.trustgate.domain.rule;

import com.vidnyan.trustgate.domain.graph.GraphKind;
import com.vidnyan.trustgate.domain.graph.ProgramGraph;
import com.vidnyan.trustgate.domain.meta.MetaAst;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the rules of a set against one tree.
 * A rule that throws yields a FAILED result and no findings; the remaining
 * rules still run.
 */
@Slf4j
public class RuleEngine {

    /**
     * Evaluate every rule of the set in registration order. Disabled rules and
     * rules scoped to other languages yield a SKIPPED result.
     */
    public List<EvaluationResult> evaluate(RuleSet ruleSet, MetaAst ast, Map<GraphKind, ProgramGraph> graphs) {
        String language = ast.language();
        int nodes = ast.root().preOrder().size();

        List<EvaluationResult> results = new ArrayList<>();
        for (Rule rule : ruleSet.rules()) {
            if (!rule.enabled()) {
                results.add(EvaluationResult.skipped(rule.id(), "disabled"));
            } else if (!rule.appliesTo(language)) {
                results.add(EvaluationResult.skipped(rule.id(), "not applicable to " + language));
            } else {
                results.add(evaluate(rule, EvaluationContext.of(rule, ast, graphs), nodes));
            }
        }
        log.debug("Rules for {}: {} completed, {} failed, {} skipped", language,
                count(results, EvaluationResult.Status.COMPLETED),
                count(results, EvaluationResult.Status.FAILED),
                count(results, EvaluationResult.Status.SKIPPED));
        return results;
    }

    static long count(List<EvaluationResult> results, EvaluationResult.Status status) {
        return results.stream().filter(r -> r.is(status)).count();
    }

    private EvaluationResult evaluate(Rule rule, EvaluationContext context, int nodes) {
        long start = System.nanoTime();
        try {
            List<Finding> findings = rule.evaluator().evaluate(context);
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            if (findings == null) {
                findings = List.of();
            }
            if (!findings.isEmpty()) {
                log.debug("  {} found {} findings", rule.id(), findings.size());
            }
            return EvaluationResult.completed(rule.id(), findings, duration, nodes);
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Error evaluating rule {}: {}", rule.id(), e.toString());
            return EvaluationResult.failed(rule.id(), String.valueOf(e.getMessage()));
        }
    }

    /**
     * Concatenate the findings of all results, in order.
     */
    public static List<Finding> findingsOf(List<EvaluationResult> results) {
        List<Finding> findings = new ArrayList<>();
        for (EvaluationResult result : results) {
            findings.addAll(result.findings());
        }
        return findings;
    }
}
