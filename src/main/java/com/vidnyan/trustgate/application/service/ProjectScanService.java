package com.vidnyan.trustgate.application.service;

import com.vidnyan.trustgate.application.port.in.ScanProjectUseCase;
import com.vidnyan.trustgate.application.port.in.VerifyCodeUseCase;
import com.vidnyan.trustgate.application.port.in.VerifyCodeUseCase.VerificationRequest;
import com.vidnyan.trustgate.domain.report.ProjectScanReport;
import com.vidnyan.trustgate.domain.report.ProjectScanReport.FileEntry;
import com.vidnyan.trustgate.domain.report.VerificationReport;
import com.vidnyan.trustgate.scanner.SourceScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Verifies source files found on disk, one {@code verify} call per file.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectScanService implements ScanProjectUseCase {

    private final SourceScanner scanner;
    private final VerifyCodeUseCase verifier;

    @Override
    public ProjectScanReport scanProject(Path root) throws IOException {
        log.info("Scanning {}", root);
        List<Path> files = scanner.scanSourceFiles(root);
        log.info("Found {} source files", files.size());

        List<FileEntry> entries = new ArrayList<>();
        for (Path file : files) {
            String relative = relativeName(root, file);
            try {
                entries.add(FileEntry.verified(relative, verifyFile(file)));
            } catch (IOException e) {
                log.warn("Cannot read {}: {}", relative, e.toString());
                entries.add(FileEntry.failed(relative, String.valueOf(e.getMessage())));
            }
        }

        ProjectScanReport report = ProjectScanReport.of(entries);
        log.info("Scan complete: {} files, {} findings", entries.size(), report.totalFindings());
        return report;
    }

    @Override
    public VerificationReport verifyFile(Path file) throws IOException {
        // malformed UTF-8 is replaced rather than rejected
        String code = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return verifier.verify(VerificationRequest.forFile(code, file.getFileName().toString()));
    }

    private static String relativeName(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
