package com.vidnyan.trustgate.domain.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;

/**
 * Result of scanning a directory tree.
 */
public record ProjectScanReport(
    List<FileEntry> files,
    @JsonProperty("total_findings") int totalFindings
) {

    public static ProjectScanReport of(List<FileEntry> files) {
        return new ProjectScanReport(
                List.copyOf(files),
                files.stream().mapToInt(FileEntry::findingCount).sum());
    }

    /**
     * One scanned file: its report, or the error that kept it from being verified.
     *
     * @param file path relative to the scanned root, with '/' separators
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record FileEntry(
        String file,
        @JsonUnwrapped VerificationReport report,
        String error
    ) {

        public static FileEntry verified(String file, VerificationReport report) {
            return new FileEntry(file, report, null);
        }

        public static FileEntry failed(String file, String error) {
            return new FileEntry(file, null, error);
        }

        @JsonIgnore
        public boolean isVerified() {
            return report != null;
        }

        @JsonIgnore
        public int findingCount() {
            return report == null ? 0 : report.findingCount();
        }
    }
}
