package com.vidnyan.trustgate.adapter.out.evaluator;

import com.vidnyan.trustgate.domain.meta.MetaAst;
import com.vidnyan.trustgate.domain.rule.EvaluationContext;
import com.vidnyan.trustgate.domain.rule.Finding;
import com.vidnyan.trustgate.domain.rule.Rule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.vidnyan.trustgate.support.TestTrees.evaluate;
import static com.vidnyan.trustgate.support.TestTrees.python;
import static org.junit.jupiter.api.Assertions.*;

class TaintFlowEvaluatorTest {

    private final TaintFlowEvaluator evaluator = new TaintFlowEvaluator();

    @Test
    void evaluate_OneFindingPerFlowAtTheSink() {
        List<Finding> findings = evaluate(evaluator, TaintFlowEvaluator.ID,
                python("data = input('Enter: ')\neval(data)\n"));

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals(2, finding.line());
        assertEquals("Untrusted data from `SOURCE: input` (L1) reaches dangerous sink `SINK: eval` (L2)",
                finding.message());
        assertNotNull(finding.fixHint());
    }

    @Test
    void evaluate_TwoSourcesOneSink() {
        List<Finding> findings = evaluate(evaluator, TaintFlowEvaluator.ID,
                python("a = input()\nb = os.getenv('X')\nos.system(a + b)\n"));

        assertEquals(2, findings.size());
        assertTrue(findings.stream().allMatch(f -> f.line() == 3));
    }

    @Test
    void evaluate_WithoutTaintGraphReportsNothing() {
        MetaAst ast = python("data = input()\neval(data)\n");
        Rule rule = Rule.builder().id(TaintFlowEvaluator.ID).evaluator(evaluator).build();

        List<Finding> findings = evaluator.evaluate(EvaluationContext.of(rule, ast, Map.of()));

        assertTrue(findings.isEmpty());
    }
}
