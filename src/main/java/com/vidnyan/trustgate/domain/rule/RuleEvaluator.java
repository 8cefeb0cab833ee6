package com.vidnyan.trustgate.domain.rule;

import java.util.List;

/**
 * Matching logic of a rule.
 * Must not modify the tree or the graphs it is given.
 */
@FunctionalInterface
public interface RuleEvaluator {

    /**
     * Evaluate the rule against one tree and its graphs.
     */
    List<Finding> evaluate(EvaluationContext context);

    /**
     * Get the evaluator name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
