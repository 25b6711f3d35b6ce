/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.table;

import java.util.List;

/**
 * Output column schema shared by per-case and merged tables.
 * ProjectID is always the first column.
 */
public final class FixedColumns {

    public static final String PROJECT_ID = "ProjectID";
    public static final String FILE_NAME = "FileName";
    public static final String PATIENT_NAME = "PatientName";
    public static final String PATIENT_ID = "PatientID";
    public static final String STUDY_DATE = "StudyDate";
    public static final String PATIENT_BIRTH_DATE = "PatientBirthDate";
    public static final String PATIENT_AGE = "PatientAge";
    public static final String PATIENT_SEX = "PatientSex";
    public static final String STUDY_INSTANCE_UID = "StudyInstanceUID";
    public static final String SERIES_INSTANCE_UID = "SeriesInstanceUID";
    public static final String MODALITY = "Modality";
    public static final String MANUFACTURER = "Manufacturer";
    public static final String ROWS = "Rows";
    public static final String COLUMNS = "Columns";
    public static final String IMAGE_COUNT = "ImageCount";
    public static final String SERIES_COUNT = "SeriesCount";

    public static final List<String> ALL = List.of(
            PROJECT_ID,
            FILE_NAME,
            PATIENT_NAME,
            PATIENT_ID,
            STUDY_DATE,
            PATIENT_BIRTH_DATE,
            PATIENT_AGE,
            PATIENT_SEX,
            STUDY_INSTANCE_UID,
            SERIES_INSTANCE_UID,
            MODALITY,
            MANUFACTURER,
            ROWS,
            COLUMNS,
            IMAGE_COUNT,
            SERIES_COUNT
    );

    private FixedColumns() {
    }
}
