package com.vidnyan.trustgate.domain.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.trustgate.domain.meta.MetaNode;
import com.vidnyan.trustgate.domain.meta.NodeKind;
import com.vidnyan.trustgate.domain.rule.Finding;
import com.vidnyan.trustgate.domain.rule.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VerificationReportTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void of_DerivesValidityAndSubLists() {
        MetaNode call = MetaNode.builder(NodeKind.CALL).name("eval").line(3).column(4).build();
        List<Finding> findings = List.of(
                Finding.builder().ruleId("shell_injection").message("m").severity(Severity.ERROR).at(call).build(),
                Finding.builder().ruleId("unused_import").message("m").severity(Severity.WARNING).line(1).build());

        VerificationReport report = VerificationReport.of(findings, "python", true, 1.23456, "abc");

        assertFalse(report.valid());
        assertEquals(0.8, report.confidenceScore());
        assertEquals(1, report.errors().size());
        assertEquals(1, report.warnings().size());
        assertEquals(1.23, report.elapsedMs());
        assertNull(report.findings().get(0).node());
        assertEquals(3, report.findings().get(0).line());
        assertTrue(report.hasFinding("unused_import"));
    }

    @Test
    void of_WarningsAloneKeepReportValid() {
        List<Finding> findings = List.of(
                Finding.builder().ruleId("bare_except").message("m").severity(Severity.WARNING).line(2).build());

        VerificationReport report = VerificationReport.of(findings, "python", true, 0, "h");

        assertTrue(report.valid());
        assertEquals(0.95, report.confidenceScore());
    }

    @Test
    void parseFailure_SingleErrorFinding() {
        VerificationReport report = VerificationReport.parseFailure("javascript", 0.5, "h");

        assertFalse(report.valid());
        assertFalse(report.parseOk());
        assertEquals(0.0, report.confidenceScore());
        assertEquals(1, report.findingCount());
        assertEquals("parse_error", report.findings().get(0).ruleId());
        assertEquals("Failed to parse javascript code", report.findings().get(0).message());
    }

    @Test
    void json_UsesWireFieldNames() throws Exception {
        Finding finding = Finding.builder()
                .ruleId("hardcoded_secret").message("Hardcoded secret in variable `password`")
                .severity(Severity.ERROR).line(1).column(0).endLine(1).endColumn(22)
                .fixHint("Use environment variables or a secrets manager instead.")
                .build();
        VerificationReport report = VerificationReport.of(List.of(finding), "python", true, 0.42, "0123456789abcdef");

        JsonNode json = mapper.readTree(mapper.writeValueAsString(report));

        assertEquals(List.of("is_valid", "confidence_score", "findings", "errors", "warnings",
                "language", "parse_ok", "elapsed_ms", "code_hash", "issues"), fieldNames(json));
        assertEquals(List.of("rule", "message", "severity", "line", "column", "end_line", "end_column", "fix_hint"),
                fieldNames(json.get("findings").get(0)));
        assertEquals("error", json.get("findings").get(0).get("severity").asText());
        assertEquals(List.of("severity", "line", "message", "fix_hint"), fieldNames(json.get("issues").get(0)));
        assertFalse(json.get("is_valid").asBoolean());
        assertEquals("0123456789abcdef", json.get("code_hash").asText());
    }

    @Test
    void batch_AggregatesReports() throws Exception {
        VerificationReport clean = VerificationReport.of(List.of(), "python", true, 0, "a");
        VerificationReport failed = VerificationReport.parseFailure("python", 0, "b");

        BatchReport batch = BatchReport.of(List.of(clean, failed));
        JsonNode json = mapper.readTree(mapper.writeValueAsString(batch));

        assertEquals(1, batch.totalFindings());
        assertFalse(batch.valid());
        assertTrue(BatchReport.of(List.of()).valid());
        assertEquals(List.of("is_valid", "total_findings", "reports"), fieldNames(json));
    }

    @Test
    void scanEntry_UnwrapsReportOrCarriesError() throws Exception {
        ProjectScanReport scan = ProjectScanReport.of(List.of(
                ProjectScanReport.FileEntry.verified("app.py", VerificationReport.parseFailure("python", 0, "c")),
                ProjectScanReport.FileEntry.failed("gone.py", "No such file")));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(scan));

        assertEquals(1, scan.totalFindings());
        JsonNode verified = json.get("files").get(0);
        assertEquals("app.py", verified.get("file").asText());
        assertTrue(verified.has("confidence_score"));
        assertFalse(verified.has("error"));
        JsonNode failed = json.get("files").get(1);
        assertEquals("No such file", failed.get("error").asText());
        assertFalse(failed.has("is_valid"));
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        Iterator<String> it = node.fieldNames();
        it.forEachRemaining(names::add);
        return names;
    }
}
