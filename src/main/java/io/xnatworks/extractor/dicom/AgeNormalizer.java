/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.dicom;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Derives a single integer age for a record.
 *
 * <ol>
 *   <li>PatientAge (e.g. "043Y" or "43"): all non-digit characters are stripped
 *       and the remaining digits parsed. The unit suffix is not interpreted.</li>
 *   <li>Otherwise whole years between PatientBirthDate and StudyDate, both
 *       in DICOM DA form (yyyyMMdd).</li>
 *   <li>Otherwise null.</li>
 * </ol>
 */
public final class AgeNormalizer {

    private static final DateTimeFormatter DICOM_DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

    private AgeNormalizer() {
    }

    public static Integer normalize(String rawAge, String birthDate, String studyDate) {
        Integer fromTag = parseAgeString(rawAge);
        if (fromTag != null) {
            return fromTag;
        }
        return yearsBetween(birthDate, studyDate);
    }

    static Integer parseAgeString(String rawAge) {
        if (rawAge == null || rawAge.isEmpty()) {
            return null;
        }
        String digits = rawAge.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // more digits than an int holds
            return null;
        }
    }

    static Integer yearsBetween(String birthDate, String studyDate) {
        LocalDate birth = parseDate(birthDate);
        LocalDate study = parseDate(studyDate);
        if (birth == null || study == null) {
            return null;
        }
        int years = study.getYear() - birth.getYear();
        if (study.getMonthValue() < birth.getMonthValue()
                || (study.getMonthValue() == birth.getMonthValue() && study.getDayOfMonth() < birth.getDayOfMonth())) {
            years--;
        }
        return years;
    }

    private static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() != 8) {
            return null;
        }
        try {
            return LocalDate.parse(trimmed, DICOM_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
