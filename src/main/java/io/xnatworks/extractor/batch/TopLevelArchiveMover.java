/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.batch;

import io.xnatworks.extractor.archive.ArchiveFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Moves archives lying directly under the data root into a case folder named
 * after the archive, so that {@code Case_C.zip} becomes {@code Case_C/Case_C.zip}.
 * Name collisions inside the folder get a numeric suffix ({@code Case_C_1.zip}).
 */
public class TopLevelArchiveMover {
    private static final Logger log = LoggerFactory.getLogger(TopLevelArchiveMover.class);

    /**
     * @param dryRun log the planned moves without touching the filesystem
     * @return destination of every archive moved (or that would be moved)
     */
    public List<Path> moveAll(Path dataRoot, boolean dryRun) throws IOException {
        List<Path> archives;
        try (Stream<Path> paths = Files.list(dataRoot)) {
            archives = paths.filter(Files::isRegularFile)
                    .filter(ArchiveFormat::isArchive)
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<Path> moved = new ArrayList<>();
        for (Path archive : archives) {
            String fileName = archive.getFileName().toString();
            ArchiveFormat format = ArchiveFormat.detect(archive);
            Path destDir = dataRoot.resolve(format.stem(fileName));
            if (Files.exists(destDir) && !Files.isDirectory(destDir)) {
                log.warn("Skipping move: destination exists and is not a directory: {}", destDir);
                continue;
            }
            Path dest = freeName(destDir, fileName, format);
            if (dryRun) {
                log.info("[dry-run] Would move top-level archive {} -> {}", archive, dest);
                moved.add(dest);
                continue;
            }
            try {
                Files.createDirectories(destDir);
                Files.move(archive, dest);
                log.info("Moved top-level archive {} -> {}", archive, dest);
                moved.add(dest);
            } catch (IOException e) {
                log.error("Failed to move top-level archive {}: {}", archive, e.getMessage());
            }
        }
        return moved;
    }

    static Path freeName(Path dir, String fileName, ArchiveFormat format) {
        Path candidate = dir.resolve(fileName);
        if (!Files.exists(candidate)) {
            return candidate;
        }
        String base = format.stem(fileName);
        String ext = format.extensionOf(fileName);
        for (int i = 1; ; i++) {
            candidate = dir.resolve(base + "_" + i + ext);
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
    }
}
