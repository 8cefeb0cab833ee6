package com.vidnyan.trustgate.domain.report;

import com.vidnyan.trustgate.domain.rule.Finding;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Heuristic quality estimate in [0, 1]. Not a probability.
 * Starts at 1.0, loses 0.3 for a degraded parse and a fixed amount per finding
 * by severity; hints cost nothing.
 */
public final class ConfidenceScore {

    static final double PARSE_PENALTY = 0.3;
    static final double ERROR_PENALTY = 0.15;
    static final double WARNING_PENALTY = 0.05;
    static final double INFO_PENALTY = 0.02;

    private ConfidenceScore() {
    }

    public static double compute(List<Finding> findings, boolean parseOk) {
        double score = 1.0;
        if (!parseOk) {
            score -= PARSE_PENALTY;
        }
        for (Finding finding : findings) {
            score -= switch (finding.severity()) {
                case ERROR -> ERROR_PENALTY;
                case WARNING -> WARNING_PENALTY;
                case INFO -> INFO_PENALTY;
                case HINT -> 0.0;
            };
        }
        return Math.max(0.0, Math.min(1.0, round(score)));
    }

    /**
     * Round half-up to two decimals.
     */
    public static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
