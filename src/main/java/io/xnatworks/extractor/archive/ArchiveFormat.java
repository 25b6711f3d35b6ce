/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.archive;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Container formats expanded by the archive aggregator, recognized by file name.
 */
public enum ArchiveFormat {
    ZIP(".zip"),
    TAR_GZ(".tar.gz", ".tgz"),
    TAR(".tar");

    private final String[] extensions;

    ArchiveFormat(String... extensions) {
        this.extensions = extensions;
    }

    /**
     * @return the matching format, or null when the file is not an archive
     */
    public static ArchiveFormat detect(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return null;
        }
        String lower = name.toString().toLowerCase(Locale.ROOT);
        for (ArchiveFormat format : values()) {
            for (String ext : format.extensions) {
                if (lower.endsWith(ext) && lower.length() > ext.length()) {
                    return format;
                }
            }
        }
        return null;
    }

    public static boolean isArchive(Path file) {
        return detect(file) != null;
    }

    /**
     * File name with the archive extension removed, e.g. "Case_7.tar.gz" -> "Case_7".
     */
    public String stem(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (lower.endsWith(ext)) {
                return fileName.substring(0, fileName.length() - ext.length());
            }
        }
        return fileName;
    }

    /**
     * Extension as it appears in the given file name, e.g. ".ZIP".
     */
    public String extensionOf(String fileName) {
        return fileName.substring(stem(fileName).length());
    }
}
