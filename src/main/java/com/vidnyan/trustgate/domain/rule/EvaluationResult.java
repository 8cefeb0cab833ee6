package com.vidnyan.trustgate.domain.rule;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one rule against one tree.
 *
 * @param detail error message for {@link Status#FAILED}, reason for {@link Status#SKIPPED}, otherwise null
 */
public record EvaluationResult(
    String ruleId,
    Status status,
    List<Finding> findings,
    Duration elapsed,
    int nodesVisited,
    String detail
) {

    public enum Status {
        COMPLETED,
        FAILED,
        SKIPPED
    }

    public static EvaluationResult completed(String ruleId, List<Finding> findings, Duration elapsed, int nodes) {
        return new EvaluationResult(ruleId, Status.COMPLETED, List.copyOf(findings), elapsed, nodes, null);
    }

    public static EvaluationResult failed(String ruleId, String message) {
        return new EvaluationResult(ruleId, Status.FAILED, List.of(), Duration.ZERO, 0, message);
    }

    /**
     * A rule that did not run, either disabled or scoped to other languages.
     */
    public static EvaluationResult skipped(String ruleId, String reason) {
        return new EvaluationResult(ruleId, Status.SKIPPED, List.of(), Duration.ZERO, 0, reason);
    }

    public boolean is(Status expected) {
        return status == expected;
    }
}
