package com.vidnyan.trustgate.application.port.in;

import com.vidnyan.trustgate.domain.report.ProjectScanReport;
import com.vidnyan.trustgate.domain.report.VerificationReport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Verify source files on disk.
 */
public interface ScanProjectUseCase {

    /**
     * Verify every file under a directory whose extension a registered language claims.
     * Hidden directories, {@code node_modules} and {@code __pycache__} are skipped;
     * unreadable files are listed with an error instead of a report.
     *
     * @throws IOException when the directory itself cannot be walked
     */
    ProjectScanReport scanProject(Path root) throws IOException;

    /**
     * Verify a single file, detecting its language from the file name.
     */
    VerificationReport verifyFile(Path file) throws IOException;
}
