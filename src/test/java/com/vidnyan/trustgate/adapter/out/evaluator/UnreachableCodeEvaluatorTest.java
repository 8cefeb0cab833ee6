package com.vidnyan.trustgate.adapter.out.evaluator;

import com.vidnyan.trustgate.domain.rule.Finding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.trustgate.support.TestTrees.evaluate;
import static com.vidnyan.trustgate.support.TestTrees.javascript;
import static com.vidnyan.trustgate.support.TestTrees.python;
import static org.junit.jupiter.api.Assertions.*;

class UnreachableCodeEvaluatorTest {

    private final UnreachableCodeEvaluator evaluator = new UnreachableCodeEvaluator();

    @Test
    void evaluate_StatementsAfterReturn() {
        List<Finding> findings = evaluate(evaluator, UnreachableCodeEvaluator.ID,
                python("def f():\n    return 1\n    x = 2\n    log(x)\n"));

        assertEquals(List.of(3, 4), findings.stream().map(Finding::line).toList());
        assertEquals("Unreachable code after return/raise statement", findings.get(0).message());
    }

    @Test
    void evaluate_StatementsAfterRaiseInNestedBlock() {
        List<Finding> findings = evaluate(evaluator, UnreachableCodeEvaluator.ID,
                python("def f(x):\n    if x:\n        raise ValueError()\n        cleanup()\n    return x\n"));

        assertEquals(1, findings.size());
        assertEquals(4, findings.get(0).line());
    }

    @Test
    void evaluate_NestedFunctionsReportedOnce() {
        List<Finding> findings = evaluate(evaluator, UnreachableCodeEvaluator.ID,
                python("def outer():\n    def inner():\n        return 1\n        dead()\n    return inner\n"));

        assertEquals(1, findings.size());
    }

    @Test
    void evaluate_JavaScriptThrow() {
        List<Finding> findings = evaluate(evaluator, UnreachableCodeEvaluator.ID,
                javascript("function f() {\n  throw new Error('x');\n  console.log('never');\n}\n"));

        assertEquals(1, findings.size());
        assertEquals(3, findings.get(0).line());
    }

    @Test
    void evaluate_ModuleLevelCodeIsIgnored() {
        assertTrue(evaluate(evaluator, UnreachableCodeEvaluator.ID, python("x = 1\ny = 2\n")).isEmpty());
    }
}
