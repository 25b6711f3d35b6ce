/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.dicom;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AgeNormalizer.
 */
@DisplayName("Age Normalizer Tests")
class AgeNormalizerTest {

    @Nested
    @DisplayName("PatientAge tag")
    class AgeTagTests {

        @Test
        @DisplayName("Should strip the unit suffix and leading zeros")
        void shouldParseDicomAgeString() {
            assertEquals(43, AgeNormalizer.normalize("043Y", null, null));
        }

        @Test
        @DisplayName("Should ignore the unit letter for months")
        void shouldIgnoreUnitLetter() {
            assertEquals(6, AgeNormalizer.normalize("006M", null, null));
        }

        @Test
        @DisplayName("Should prefer the tag over date arithmetic")
        void shouldPreferTagOverDates() {
            assertEquals(43, AgeNormalizer.normalize("43", "19800101", "20200101"));
        }

        @Test
        @DisplayName("Should fall back to dates when the tag has no digits")
        void shouldFallBackWhenNoDigits() {
            assertEquals(40, AgeNormalizer.normalize("Y", "19800101", "20200101"));
        }
    }

    @Nested
    @DisplayName("Date arithmetic")
    class DateTests {

        @Test
        @DisplayName("Should count whole years on the birthday")
        void shouldCountOnBirthday() {
            assertEquals(40, AgeNormalizer.normalize(null, "19800101", "20200101"));
        }

        @Test
        @DisplayName("Should subtract a year before the birthday")
        void shouldSubtractBeforeBirthday() {
            assertEquals(39, AgeNormalizer.normalize(null, "19800601", "20200101"));
        }

        @Test
        @DisplayName("Should compare day of month within the birth month")
        void shouldCompareDayOfMonth() {
            assertEquals(39, AgeNormalizer.normalize(null, "19800615", "20200614"));
            assertEquals(40, AgeNormalizer.normalize(null, "19800615", "20200615"));
        }

        @Test
        @DisplayName("Should reject malformed dates")
        void shouldRejectMalformedDates() {
            assertNull(AgeNormalizer.normalize(null, "1980-01-01", "20200101"));
            assertNull(AgeNormalizer.normalize(null, "19801301", "20200101"));
            assertNull(AgeNormalizer.normalize(null, "19800101", "2020"));
        }
    }

    @Test
    @DisplayName("Should return null when nothing is available")
    void shouldReturnNullWhenAbsent() {
        assertNull(AgeNormalizer.normalize(null, null, null));
        assertNull(AgeNormalizer.normalize("", null, "20200101"));
    }
}
