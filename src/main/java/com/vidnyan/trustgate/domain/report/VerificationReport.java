package com.vidnyan.trustgate.domain.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.vidnyan.trustgate.domain.rule.Finding;
import com.vidnyan.trustgate.domain.rule.Severity;

import java.util.List;

/**
 * Outcome of one verification run.
 * Immutable; findings are detached from the tree they came from.
 */
@JsonPropertyOrder({"is_valid", "confidence_score", "findings", "errors", "warnings",
        "language", "parse_ok", "elapsed_ms", "code_hash", "issues"})
public record VerificationReport(
    @JsonProperty("is_valid") boolean valid,
    @JsonProperty("confidence_score") double confidenceScore,
    List<Finding> findings,
    List<Finding> errors,
    List<Finding> warnings,
    String language,
    @JsonProperty("parse_ok") boolean parseOk,
    @JsonProperty("elapsed_ms") double elapsedMs,
    @JsonProperty("code_hash") String codeHash
) {

    public VerificationReport {
        findings = List.copyOf(findings);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /**
     * Assemble a report, deriving the sub-lists, validity and confidence.
     */
    public static VerificationReport of(List<Finding> findings, String language, boolean parseOk,
                                        double elapsedMs, String codeHash) {
        List<Finding> detached = findings.stream().map(Finding::detached).toList();
        List<Finding> errors = detached.stream().filter(f -> f.is(Severity.ERROR)).toList();
        List<Finding> warnings = detached.stream().filter(f -> f.is(Severity.WARNING)).toList();
        return new VerificationReport(
                errors.isEmpty() && parseOk,
                ConfidenceScore.compute(detached, parseOk),
                detached, errors, warnings,
                language, parseOk,
                ConfidenceScore.round(elapsedMs),
                codeHash);
    }

    /**
     * Report for input that could not be parsed at all.
     */
    public static VerificationReport parseFailure(String language, double elapsedMs, String codeHash) {
        Finding failure = Finding.builder()
                .ruleId("parse_error")
                .message(String.format("Failed to parse %s code", language))
                .severity(Severity.ERROR)
                .line(1)
                .build();
        return new VerificationReport(false, 0.0, List.of(failure), List.of(failure), List.of(),
                language, false, ConfidenceScore.round(elapsedMs), codeHash);
    }

    /**
     * Flattened view for front-ends.
     */
    @JsonProperty("issues")
    public List<Issue> issues() {
        return findings.stream().map(Issue::of).toList();
    }

    public int findingCount() {
        return findings.size();
    }

    public boolean hasFinding(String ruleId) {
        return findings.stream().anyMatch(f -> f.ruleId().equals(ruleId));
    }

    @JsonPropertyOrder({"severity", "line", "message", "fix_hint"})
    public record Issue(
        Severity severity,
        int line,
        String message,
        @JsonProperty("fix_hint") String fixHint
    ) {

        static Issue of(Finding finding) {
            return new Issue(finding.severity(), finding.line(), finding.message(), finding.fixHint());
        }
    }
}
