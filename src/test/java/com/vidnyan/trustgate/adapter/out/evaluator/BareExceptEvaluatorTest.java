package com.vidnyan.trustgate.adapter.out.evaluator;

import com.vidnyan.trustgate.domain.meta.MetaNode;
import com.vidnyan.trustgate.domain.meta.NodeKind;
import com.vidnyan.trustgate.domain.rule.Finding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.trustgate.support.TestTrees.evaluate;
import static com.vidnyan.trustgate.support.TestTrees.python;
import static org.junit.jupiter.api.Assertions.*;

class BareExceptEvaluatorTest {

    private final BareExceptEvaluator evaluator = new BareExceptEvaluator();

    @Test
    void evaluate_BareAndBroadHandlers() {
        String code = """
                try:
                    a()
                except:
                    pass
                try:
                    b()
                except (Exception) as e:
                    log(e)
                try:
                    c()
                except ValueError:
                    pass
                except BaseException:
                    raise
                """;

        List<Finding> findings = evaluate(evaluator, BareExceptEvaluator.ID, python(code));

        assertEquals(List.of(1, 5, 9), findings.stream().map(Finding::line).toList());
        assertEquals("Bare `except` swallows all exceptions; catch specific types", findings.get(0).message());
    }

    @Test
    void evaluate_SpecificHandlersAreFine() {
        String code = "try:\n    a()\nexcept (KeyError, ValueError):\n    pass\nfinally:\n    close()\n";

        assertTrue(evaluate(evaluator, BareExceptEvaluator.ID, python(code)).isEmpty());
    }

    @Test
    void evaluate_OneFindingPerTryStatement() {
        String code = "try:\n    a()\nexcept Exception:\n    pass\nexcept:\n    pass\n";

        assertEquals(1, evaluate(evaluator, BareExceptEvaluator.ID, python(code)).size());
    }

    @Test
    void catchesEverything_FallsBackToTextWithoutSyntax() {
        MetaNode bare = MetaNode.builder(NodeKind.TRY_EXCEPT).text("try:\n    a()\nexcept:\n    pass").build();
        MetaNode specific = MetaNode.builder(NodeKind.TRY_EXCEPT).text("try:\n    a()\nexcept OSError:\n    pass").build();

        assertTrue(BareExceptEvaluator.catchesEverything(bare, ""));
        assertFalse(BareExceptEvaluator.catchesEverything(specific, ""));
    }
}
