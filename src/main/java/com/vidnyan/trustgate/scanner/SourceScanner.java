package com.vidnyan.trustgate.scanner;

import com.vidnyan.trustgate.domain.language.LanguageRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Scans a directory tree for source files of the registered languages.
 * Hidden entries and dependency or bytecode directories are skipped.
 */
@Component
@RequiredArgsConstructor
public class SourceScanner {

    static final Set<String> SKIPPED_DIRECTORIES = Set.of("node_modules", "__pycache__");

    private final LanguageRegistry registry;

    /**
     * Scan and return all source files under a root, sorted by path.
     */
    public List<Path> scanSourceFiles(Path root) throws IOException {
        List<Path> sourceFiles = new ArrayList<>();

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && isSkipped(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                String name = file.getFileName().toString();
                if (attrs.isRegularFile() && !name.startsWith(".") && registry.detect(name).isPresent()) {
                    sourceFiles.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                // kept so the failure is reported when the file is read
                if (registry.detect(file.getFileName().toString()).isPresent()) {
                    sourceFiles.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });

        sourceFiles.sort(null);
        return sourceFiles;
    }

    static boolean isSkipped(String directoryName) {
        return directoryName.startsWith(".") || SKIPPED_DIRECTORIES.contains(directoryName);
    }
}
