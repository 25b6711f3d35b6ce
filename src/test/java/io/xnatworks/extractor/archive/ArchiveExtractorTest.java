/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.archive;

import io.xnatworks.extractor.DicomFixtures;
import io.xnatworks.extractor.dicom.MetadataRecord;
import io.xnatworks.extractor.dicom.TagReader;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ArchiveExtractor.
 */
@DisplayName("Archive Extractor Tests")
class ArchiveExtractorTest {

    private static final String CHINESE_NAME = "影像/图像1.dcm";

    @TempDir
    Path tempDir;

    private ArchiveExtractor extractor;
    private Path dicom;

    @BeforeEach
    void setUp() throws Exception {
        extractor = new ArchiveExtractor();
        dicom = DicomFixtures.write(tempDir.resolve("src/image.dcm"), "Li^Lei", "CN1", "20210101");
    }

    private Path zipWithCharset(String fileName, Charset charset, String entryName) throws Exception {
        Path zip = tempDir.resolve(fileName);
        try (OutputStream out = Files.newOutputStream(zip);
             ZipOutputStream zos = new ZipOutputStream(out, charset)) {
            zos.putNextEntry(new ZipEntry(entryName));
            Files.copy(dicom, zos);
            zos.closeEntry();
        }
        return zip;
    }

    private String firstEntryName(Path zip) throws Exception {
        try (InputStream in = Files.newInputStream(zip);
             ZipArchiveInputStream zis = new ZipArchiveInputStream(in)) {
            ZipArchiveEntry entry = zis.getNextZipEntry();
            assertNotNull(entry);
            return ArchiveExtractor.entryName(entry);
        }
    }

    private List<Path> extractedFiles(Path dir) throws Exception {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile).collect(Collectors.toList());
        }
    }

    @Nested
    @DisplayName("Entry names")
    class EntryNameTests {

        @Test
        @DisplayName("Should decode GBK names written without the UTF-8 flag")
        void shouldDecodeGbkNames() throws Exception {
            Path zip = zipWithCharset("gbk.zip", Charset.forName("GBK"), CHINESE_NAME);

            assertEquals(CHINESE_NAME, firstEntryName(zip));
        }

        @Test
        @DisplayName("Should keep names flagged as UTF-8")
        void shouldKeepUtf8Names() throws Exception {
            Path zip = zipWithCharset("utf8.zip", StandardCharsets.UTF_8, CHINESE_NAME);

            assertEquals(CHINESE_NAME, firstEntryName(zip));
        }

        @Test
        @DisplayName("Should keep plain ASCII names")
        void shouldKeepAsciiNames() throws Exception {
            Path zip = zipWithCharset("ascii.zip", Charset.forName("GBK"), "series1/IM0001.dcm");

            assertEquals("series1/IM0001.dcm", firstEntryName(zip));
        }
    }

    @Nested
    @DisplayName("Extraction")
    class ExtractionTests {

        @Test
        @DisplayName("Should extract entries whose names are not UTF-8")
        void shouldExtractGbkNamedEntries() throws Exception {
            Path zip = zipWithCharset("gbk.zip", Charset.forName("GBK"), CHINESE_NAME);
            Path target = Files.createDirectories(tempDir.resolve("out"));

            int count = extractor.extract(zip, ArchiveFormat.ZIP, target);

            assertEquals(1, count);
            List<Path> files = extractedFiles(target);
            assertEquals(1, files.size());
            assertTrue(files.get(0).getFileName().toString().endsWith(".dcm"));
            MetadataRecord record = new TagReader().read(files.get(0));
            assertEquals("CN1", record.getPatientId());
        }

        @Test
        @DisplayName("Should skip entries that escape the target directory")
        void shouldSkipEscapingEntries() throws Exception {
            Path zip = zipWithCharset("slip.zip", StandardCharsets.UTF_8, "../../escaped.dcm");
            Path target = Files.createDirectories(tempDir.resolve("out"));

            int count = extractor.extract(zip, ArchiveFormat.ZIP, target);

            assertEquals(0, count);
            assertFalse(Files.exists(tempDir.resolve("escaped.dcm")));
        }
    }
}
