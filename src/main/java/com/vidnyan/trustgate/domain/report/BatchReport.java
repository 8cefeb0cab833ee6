package com.vidnyan.trustgate.domain.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Reports for a batch of inputs, in input order.
 * An empty batch is valid.
 */
@JsonPropertyOrder({"is_valid", "total_findings", "reports"})
public record BatchReport(
    List<VerificationReport> reports,
    @JsonProperty("total_findings") int totalFindings,
    @JsonProperty("is_valid") boolean valid
) {

    public static BatchReport of(List<VerificationReport> reports) {
        return new BatchReport(
                List.copyOf(reports),
                reports.stream().mapToInt(VerificationReport::findingCount).sum(),
                reports.stream().allMatch(VerificationReport::valid));
    }
}
