/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.dicom;

import io.xnatworks.extractor.table.FixedColumns;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One metadata row: either a single DICOM file or an aggregated archive.
 *
 * Instances are immutable. Absent values are null. ImageCount and SeriesCount
 * are only populated for archive rows.
 */
public final class MetadataRecord {

    private final Integer projectId;
    private final String fileName;
    private final String patientName;
    private final String patientId;
    private final String studyDate;
    private final String patientBirthDate;
    private final Integer patientAge;
    private final String patientSex;
    private final String studyInstanceUid;
    private final String seriesInstanceUid;
    private final String modality;
    private final String manufacturer;
    private final Integer rows;
    private final Integer columns;
    private final Integer imageCount;
    private final Integer seriesCount;

    private MetadataRecord(Builder b) {
        this.projectId = b.projectId;
        this.fileName = b.fileName;
        this.patientName = b.patientName;
        this.patientId = b.patientId;
        this.studyDate = b.studyDate;
        this.patientBirthDate = b.patientBirthDate;
        this.patientAge = b.patientAge;
        this.patientSex = b.patientSex;
        this.studyInstanceUid = b.studyInstanceUid;
        this.seriesInstanceUid = b.seriesInstanceUid;
        this.modality = b.modality;
        this.manufacturer = b.manufacturer;
        this.rows = b.rows;
        this.columns = b.columns;
        this.imageCount = b.imageCount;
        this.seriesCount = b.seriesCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .projectId(projectId)
                .fileName(fileName)
                .patientName(patientName)
                .patientId(patientId)
                .studyDate(studyDate)
                .patientBirthDate(patientBirthDate)
                .patientAge(patientAge)
                .patientSex(patientSex)
                .studyInstanceUid(studyInstanceUid)
                .seriesInstanceUid(seriesInstanceUid)
                .modality(modality)
                .manufacturer(manufacturer)
                .rows(rows)
                .columns(columns)
                .imageCount(imageCount)
                .seriesCount(seriesCount);
    }

    public MetadataRecord withProjectId(Integer projectId) {
        return toBuilder().projectId(projectId).build();
    }

    /**
     * Flatten to a row keyed by the fixed column names, in schema order.
     */
    public Map<String, String> toRow() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(FixedColumns.PROJECT_ID, str(projectId));
        row.put(FixedColumns.FILE_NAME, fileName);
        row.put(FixedColumns.PATIENT_NAME, patientName);
        row.put(FixedColumns.PATIENT_ID, patientId);
        row.put(FixedColumns.STUDY_DATE, studyDate);
        row.put(FixedColumns.PATIENT_BIRTH_DATE, patientBirthDate);
        row.put(FixedColumns.PATIENT_AGE, str(patientAge));
        row.put(FixedColumns.PATIENT_SEX, patientSex);
        row.put(FixedColumns.STUDY_INSTANCE_UID, studyInstanceUid);
        row.put(FixedColumns.SERIES_INSTANCE_UID, seriesInstanceUid);
        row.put(FixedColumns.MODALITY, modality);
        row.put(FixedColumns.MANUFACTURER, manufacturer);
        row.put(FixedColumns.ROWS, str(rows));
        row.put(FixedColumns.COLUMNS, str(columns));
        row.put(FixedColumns.IMAGE_COUNT, str(imageCount));
        row.put(FixedColumns.SERIES_COUNT, str(seriesCount));
        return row;
    }

    private static String str(Integer value) {
        return value != null ? value.toString() : null;
    }

    public Integer getProjectId() { return projectId; }
    public String getFileName() { return fileName; }
    public String getPatientName() { return patientName; }
    public String getPatientId() { return patientId; }
    public String getStudyDate() { return studyDate; }
    public String getPatientBirthDate() { return patientBirthDate; }
    public Integer getPatientAge() { return patientAge; }
    public String getPatientSex() { return patientSex; }
    public String getStudyInstanceUid() { return studyInstanceUid; }
    public String getSeriesInstanceUid() { return seriesInstanceUid; }
    public String getModality() { return modality; }
    public String getManufacturer() { return manufacturer; }
    public Integer getRows() { return rows; }
    public Integer getColumns() { return columns; }
    public Integer getImageCount() { return imageCount; }
    public Integer getSeriesCount() { return seriesCount; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetadataRecord)) return false;
        return toRow().equals(((MetadataRecord) o).toRow());
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileName, patientId, seriesInstanceUid, projectId);
    }

    @Override
    public String toString() {
        return "MetadataRecord" + toRow();
    }

    public static final class Builder {
        private Integer projectId;
        private String fileName;
        private String patientName;
        private String patientId;
        private String studyDate;
        private String patientBirthDate;
        private Integer patientAge;
        private String patientSex;
        private String studyInstanceUid;
        private String seriesInstanceUid;
        private String modality;
        private String manufacturer;
        private Integer rows;
        private Integer columns;
        private Integer imageCount;
        private Integer seriesCount;

        private Builder() {
        }

        public Builder projectId(Integer projectId) { this.projectId = projectId; return this; }
        public Builder fileName(String fileName) { this.fileName = fileName; return this; }
        public Builder patientName(String patientName) { this.patientName = patientName; return this; }
        public Builder patientId(String patientId) { this.patientId = patientId; return this; }
        public Builder studyDate(String studyDate) { this.studyDate = studyDate; return this; }
        public Builder patientBirthDate(String patientBirthDate) { this.patientBirthDate = patientBirthDate; return this; }
        public Builder patientAge(Integer patientAge) { this.patientAge = patientAge; return this; }
        public Builder patientSex(String patientSex) { this.patientSex = patientSex; return this; }
        public Builder studyInstanceUid(String studyInstanceUid) { this.studyInstanceUid = studyInstanceUid; return this; }
        public Builder seriesInstanceUid(String seriesInstanceUid) { this.seriesInstanceUid = seriesInstanceUid; return this; }
        public Builder modality(String modality) { this.modality = modality; return this; }
        public Builder manufacturer(String manufacturer) { this.manufacturer = manufacturer; return this; }
        public Builder rows(Integer rows) { this.rows = rows; return this; }
        public Builder columns(Integer columns) { this.columns = columns; return this; }
        public Builder imageCount(Integer imageCount) { this.imageCount = imageCount; return this; }
        public Builder seriesCount(Integer seriesCount) { this.seriesCount = seriesCount; return this; }

        /**
         * Copy every field of {@code other} that is still null here.
         * Used to fold archive contents first-non-empty-wins. FileName and the
         * archive-only counters are left alone.
         */
        public Builder fillMissingFrom(MetadataRecord other) {
            if (patientName == null) patientName = other.patientName;
            if (patientId == null) patientId = other.patientId;
            if (studyDate == null) studyDate = other.studyDate;
            if (patientBirthDate == null) patientBirthDate = other.patientBirthDate;
            if (patientAge == null) patientAge = other.patientAge;
            if (patientSex == null) patientSex = other.patientSex;
            if (studyInstanceUid == null) studyInstanceUid = other.studyInstanceUid;
            if (seriesInstanceUid == null) seriesInstanceUid = other.seriesInstanceUid;
            if (modality == null) modality = other.modality;
            if (manufacturer == null) manufacturer = other.manufacturer;
            if (rows == null) rows = other.rows;
            if (columns == null) columns = other.columns;
            return this;
        }

        public MetadataRecord build() {
            return new MetadataRecord(this);
        }
    }
}
