/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.archive;

import io.xnatworks.extractor.dicom.DicomReadException;
import io.xnatworks.extractor.dicom.ExtractionResult;
import io.xnatworks.extractor.dicom.MetadataRecord;
import io.xnatworks.extractor.dicom.TagReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Folds every DICOM file inside an archive into one synthetic record.
 *
 * <p>Per field, the first contained file (in sorted path order) with a
 * non-null value wins. If contained files disagree, for example two studies
 * bundled into one archive, later values are ignored.</p>
 *
 * <p>ImageCount is the number of decoded files and SeriesCount the number of
 * distinct SeriesInstanceUIDs among them. The archive is expanded into a
 * private workspace that is removed whatever the outcome.</p>
 */
public class ArchiveAggregator {
    private static final Logger log = LoggerFactory.getLogger(ArchiveAggregator.class);

    private static final String WORKSPACE_PREFIX = "dcm-archive-";

    private final TagReader tagReader;
    private final ArchiveExtractor extractor;
    private final Path tempRoot;

    public ArchiveAggregator(TagReader tagReader) {
        this(tagReader, new ArchiveExtractor(), null);
    }

    /**
     * @param tempRoot parent directory for expansion workspaces, or null for java.io.tmpdir
     */
    public ArchiveAggregator(TagReader tagReader, ArchiveExtractor extractor, Path tempRoot) {
        this.tagReader = tagReader;
        this.extractor = extractor;
        this.tempRoot = tempRoot;
    }

    public ExtractionResult aggregate(Path archive) {
        ArchiveFormat format = ArchiveFormat.detect(archive);
        if (format == null) {
            return ExtractionResult.failed(archive, "not a recognized archive");
        }

        try (TempWorkspace workspace = TempWorkspace.create(tempRoot, WORKSPACE_PREFIX)) {
            try {
                int extracted = extractor.extract(archive, format, workspace.getDir());
                log.debug("Expanded {} entries from {}", extracted, archive.getFileName());
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to extract archive {}: {}", archive, e.getMessage());
                return ExtractionResult.skipped(archive, "unreadable archive: " + e.getMessage());
            }

            return fold(archive, listFiles(workspace.getDir()));
        } catch (IOException e) {
            log.warn("Failed to process archive {}: {}", archive, e.getMessage());
            return ExtractionResult.failed(archive, e.getMessage());
        }
    }

    private ExtractionResult fold(Path archive, List<Path> files) {
        MetadataRecord.Builder aggregate = MetadataRecord.builder()
                .fileName(archive.getFileName().toString());
        Set<String> seriesUids = new HashSet<>();
        int imageCount = 0;

        for (Path inner : files) {
            MetadataRecord record;
            try {
                record = tagReader.read(inner);
            } catch (DicomReadException e) {
                log.warn("Failed to read inner file {} in {}: {}",
                        inner.getFileName(), archive.getFileName(), e.getMessage());
                continue;
            }
            imageCount++;
            if (record.getSeriesInstanceUid() != null) {
                seriesUids.add(record.getSeriesInstanceUid());
            }
            aggregate.fillMissingFrom(record);
        }

        if (imageCount == 0) {
            log.info("No DICOM found in archive {}", archive);
            return ExtractionResult.skipped(archive, "no decodable DICOM content");
        }

        MetadataRecord record = aggregate
                .imageCount(imageCount)
                .seriesCount(seriesUids.size())
                .build();
        log.debug("Aggregated {}: {} images, {} series", archive.getFileName(), imageCount, seriesUids.size());
        return ExtractionResult.success(archive, record);
    }

    private static List<Path> listFiles(Path dir) throws IOException {
        try (Stream<Path> paths = Files.walk(dir)) {
            return paths.filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
