/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.dicom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the fixed set of domain tags from a single DICOM file.
 *
 * Only the header is decoded; parsing stops before pixel data. Files without
 * the 128-byte preamble are accepted.
 */
public class TagReader {
    private static final Logger log = LoggerFactory.getLogger(TagReader.class);

    private final DicomHeaderParser parser = new DicomHeaderParser();

    /**
     * Read metadata from one file.
     *
     * @param file path to a DICOM file
     * @return a record with FileName set and absent tags left null
     * @throws DicomReadException if the file is not decodable or holds no attributes
     */
    public MetadataRecord read(Path file) throws DicomReadException {
        if (!Files.isRegularFile(file)) {
            throw new DicomReadException("File does not exist: " + file);
        }

        DicomHeader header;
        try {
            header = parser.parse(file);
        } catch (IOException e) {
            throw new DicomReadException("Failed to decode " + file.getFileName() + ": " + e.getMessage(), e);
        }

        if (header.isEmpty()) {
            throw new DicomReadException("No DICOM attributes in " + file.getFileName());
        }

        String rawAge = string(header, DicomTag.PATIENT_AGE);
        String birthDate = string(header, DicomTag.PATIENT_BIRTH_DATE);
        String studyDate = string(header, DicomTag.STUDY_DATE);

        MetadataRecord record = MetadataRecord.builder()
                .fileName(file.getFileName().toString())
                .patientName(string(header, DicomTag.PATIENT_NAME))
                .patientId(string(header, DicomTag.PATIENT_ID))
                .studyDate(studyDate)
                .patientBirthDate(birthDate)
                .patientAge(AgeNormalizer.normalize(rawAge, birthDate, studyDate))
                .patientSex(string(header, DicomTag.PATIENT_SEX))
                .studyInstanceUid(string(header, DicomTag.STUDY_INSTANCE_UID))
                .seriesInstanceUid(string(header, DicomTag.SERIES_INSTANCE_UID))
                .modality(string(header, DicomTag.MODALITY))
                .manufacturer(string(header, DicomTag.MANUFACTURER))
                .rows(integer(header, DicomTag.ROWS))
                .columns(integer(header, DicomTag.COLUMNS))
                .build();

        log.debug("Read {} (series {})", record.getFileName(), record.getSeriesInstanceUid());
        return record;
    }

    private static String string(DicomHeader header, int tag) {
        String value = header.getString(tag);
        if (value == null) {
            return null;
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    private static Integer integer(DicomHeader header, int tag) {
        if (!header.contains(tag)) {
            return null;
        }
        try {
            return header.getInt(tag);
        } catch (NumberFormatException e) {
            log.debug("Non-numeric value for tag {}: {}", DicomTag.toString(tag), e.getMessage());
            return null;
        }
    }
}
