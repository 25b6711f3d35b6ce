/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.archive;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Expands zip and tar containers into a target directory, keeping the entry
 * layout. Entries that would land outside the target are skipped.
 *
 * <p>Zip entry names without the UTF-8 flag are decoded as UTF-8 when they are
 * valid UTF-8, otherwise as GB18030 (names written by Chinese Windows tools),
 * and finally as CP437, the zip default.</p>
 */
public class ArchiveExtractor {
    private static final Logger log = LoggerFactory.getLogger(ArchiveExtractor.class);

    private static final Charset[] NAME_CHARSETS = {
            StandardCharsets.UTF_8, Charset.forName("GB18030"), Charset.forName("Cp437")
    };

    /**
     * Expand an archive.
     *
     * @return number of files written
     * @throws IOException if the container is unreadable or corrupt
     */
    public int extract(Path archive, ArchiveFormat format, Path targetDir) throws IOException {
        Path root = targetDir.toAbsolutePath().normalize();
        try (InputStream in = new BufferedInputStream(Files.newInputStream(archive))) {
            switch (format) {
                case ZIP:
                    return extractZip(in, root);
                case TAR_GZ:
                    return extractTar(new GzipCompressorInputStream(in), root);
                case TAR:
                    return extractTar(in, root);
                default:
                    throw new IOException("Unsupported archive format: " + format);
            }
        }
    }

    private int extractZip(InputStream inputStream, Path targetDir) throws IOException {
        int count = 0;
        try (ZipArchiveInputStream zis = new ZipArchiveInputStream(inputStream, StandardCharsets.UTF_8.name(), true, true)) {
            ZipArchiveEntry entry;
            while ((entry = zis.getNextZipEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                if (!zis.canReadEntryData(entry)) {
                    log.warn("Skipping zip entry with unsupported compression: {}", entry.getName());
                    continue;
                }
                Path targetFile = resolveEntry(targetDir, entryName(entry));
                if (targetFile == null) {
                    continue;
                }
                Files.createDirectories(targetFile.getParent());
                Files.copy(zis, targetFile);
                count++;
            }
        }
        return count;
    }

    private int extractTar(InputStream inputStream, Path targetDir) throws IOException {
        int count = 0;
        try (TarArchiveInputStream tis = new TarArchiveInputStream(inputStream)) {
            TarArchiveEntry entry;
            while ((entry = tis.getNextEntry()) != null) {
                if (!entry.isFile()) {
                    continue;
                }
                Path targetFile = resolveEntry(targetDir, entry.getName());
                if (targetFile == null) {
                    continue;
                }
                Files.createDirectories(targetFile.getParent());
                Files.copy(tis, targetFile);
                count++;
            }
        }
        return count;
    }

    static String entryName(ZipArchiveEntry entry) {
        if (entry.getGeneralPurposeBit().usesUTF8ForNames()
                || entry.getNameSource() == ZipArchiveEntry.NameSource.UNICODE_EXTRA_FIELD) {
            return entry.getName();
        }
        byte[] raw = entry.getRawName();
        if (raw == null) {
            return entry.getName();
        }
        for (Charset charset : NAME_CHARSETS) {
            try {
                return charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(raw))
                        .toString();
            } catch (CharacterCodingException e) {
                log.trace("Zip entry name is not {}", charset);
            }
        }
        return entry.getName();
    }

    /**
     * @return the normalized destination, or null if the entry must be skipped
     */
    private Path resolveEntry(Path targetDir, String name) {
        // macOS resource forks
        if (name.startsWith("__MACOSX/")) {
            return null;
        }

        Path targetFile;
        try {
            targetFile = targetDir.resolve(name).normalize();
        } catch (InvalidPathException e) {
            targetFile = asciiFallback(targetDir, name);
            log.debug("Entry name {} cannot be used on this file system, writing {}", name, targetFile);
        }
        if (!targetFile.startsWith(targetDir) || targetFile.equals(targetDir)) {
            log.warn("Skipping archive entry outside target directory: {}", name);
            return null;
        }
        if (Files.exists(targetFile)) {
            log.warn("Skipping duplicate archive entry: {}", name);
            return null;
        }
        return targetFile;
    }

    /**
     * Destination for a name the platform path encoding cannot represent:
     * non-ASCII characters become '_' and a counter keeps the name unique.
     */
    private static Path asciiFallback(Path targetDir, String name) {
        StringBuilder safe = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            safe.append(c == '/' || (c >= 0x20 && c < 0x7F) ? c : '_');
        }
        Path candidate = targetDir.resolve(safe.toString()).normalize();
        String fileName = candidate.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String ext = dot > 0 ? fileName.substring(dot) : "";
        for (int n = 2; Files.exists(candidate); n++) {
            candidate = candidate.resolveSibling(stem + "_" + n + ext);
        }
        return candidate;
    }
}
