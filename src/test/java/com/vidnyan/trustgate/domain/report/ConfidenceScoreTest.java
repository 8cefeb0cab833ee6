package com.vidnyan.trustgate.domain.report;

import com.vidnyan.trustgate.domain.rule.Finding;
import com.vidnyan.trustgate.domain.rule.Severity;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceScoreTest {

    @Test
    void compute_CleanParseWithoutFindings() {
        assertEquals(1.0, ConfidenceScore.compute(List.of(), true));
    }

    @Test
    void compute_PenaltiesBySeverity() {
        List<Finding> findings = List.of(
                finding(Severity.ERROR), finding(Severity.WARNING),
                finding(Severity.INFO), finding(Severity.HINT));

        assertEquals(0.78, ConfidenceScore.compute(findings, true));
    }

    @Test
    void compute_DegradedParseWithSyntaxError() {
        assertEquals(0.55, ConfidenceScore.compute(List.of(finding(Severity.ERROR)), false));
    }

    @Test
    void compute_NeverBelowZero() {
        List<Finding> findings = Collections.nCopies(20, finding(Severity.ERROR));

        assertEquals(0.0, ConfidenceScore.compute(findings, false));
    }

    @Test
    void round_HalfUp() {
        assertEquals(0.13, ConfidenceScore.round(0.125));
        assertEquals(12.35, ConfidenceScore.round(12.345));
        assertEquals(0.0, ConfidenceScore.round(0.004));
    }

    private static Finding finding(Severity severity) {
        return Finding.builder().ruleId("r").message("m").severity(severity).line(1).build();
    }
}
