/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * A private temporary directory deleted with all its contents on close.
 * Use with try-with-resources so the directory is removed on every exit path.
 */
public final class TempWorkspace implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TempWorkspace.class);

    private final Path dir;

    private TempWorkspace(Path dir) {
        this.dir = dir;
    }

    /**
     * Create a workspace under {@code parent}, or under java.io.tmpdir when parent is null.
     */
    public static TempWorkspace create(Path parent, String prefix) throws IOException {
        Path dir;
        if (parent != null) {
            Files.createDirectories(parent);
            dir = Files.createTempDirectory(parent, prefix);
        } else {
            dir = Files.createTempDirectory(prefix);
        }
        log.debug("Created workspace {}", dir);
        return new TempWorkspace(dir);
    }

    public Path getDir() {
        return dir;
    }

    @Override
    public void close() {
        try {
            deleteRecursively(dir);
            log.debug("Removed workspace {}", dir);
        } catch (IOException e) {
            log.warn("Failed to remove workspace {}: {}", dir, e.getMessage());
        }
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) return;

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
