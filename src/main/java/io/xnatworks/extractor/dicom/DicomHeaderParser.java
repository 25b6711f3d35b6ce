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

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * Streaming reader for the header of a DICOM Part 10 file.
 *
 * <p>Reads the optional 128-byte preamble and "DICM" magic, the file meta group
 * and then dataset elements up to {@link DicomTag#LAST_READ}. Parsing stops there,
 * so pixel data is never read. Sequences are skipped. Only the values of the
 * extracted tags are kept in memory.</p>
 *
 * <p>Supported transfer syntaxes for the dataset: implicit VR little endian,
 * explicit VR little and big endian, and deflated explicit VR little endian.
 * Compressed pixel syntaxes use explicit VR little endian for the header, so they
 * are read the same way. Without file meta information the encoding is guessed
 * from the first element.</p>
 */
public class DicomHeaderParser {
    private static final Logger log = LoggerFactory.getLogger(DicomHeaderParser.class);

    private static final int PREAMBLE_LENGTH = 128;
    private static final int UNDEFINED_LENGTH = -1;
    private static final int MAX_VALUE_LENGTH = 64 * 1024;
    private static final int MAX_NESTING = 32;

    private static final Set<Integer> KEPT_TAGS = Set.of(
            DicomTag.SPECIFIC_CHARACTER_SET,
            DicomTag.STUDY_DATE,
            DicomTag.MODALITY,
            DicomTag.MANUFACTURER,
            DicomTag.PATIENT_NAME,
            DicomTag.PATIENT_ID,
            DicomTag.PATIENT_BIRTH_DATE,
            DicomTag.PATIENT_SEX,
            DicomTag.PATIENT_AGE,
            DicomTag.STUDY_INSTANCE_UID,
            DicomTag.SERIES_INSTANCE_UID,
            DicomTag.ROWS,
            DicomTag.COLUMNS
    );

    // VRs encoded with 2 reserved bytes and a 4-byte length in explicit VR syntaxes
    private static final Set<String> LONG_LENGTH_VRS = Set.of(
            "OB", "OD", "OF", "OL", "OV", "OW", "SQ", "SV", "UC", "UN", "UR", "UT", "UV");

    public DicomHeader parse(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in);
        }
    }

    /**
     * Parse a DICOM stream. The stream is not closed.
     *
     * @throws DicomStreamException if the stream is not DICOM or is malformed
     * @throws EOFException if the stream ends inside an element
     */
    public DicomHeader parse(InputStream stream) throws IOException {
        BufferedInputStream in = new BufferedInputStream(stream);
        boolean hasPreamble = skipPreamble(in);

        ElementInput meta = new ElementInput(in, false, true);
        String transferSyntax = null;
        while (meta.peekGroup() == 0x0002) {
            ElementHeader element = meta.readHeader();
            if (element.length == UNDEFINED_LENGTH) {
                throw new DicomStreamException("Undefined length in file meta element " + DicomTag.toString(element.tag));
            }
            if (element.tag == DicomTag.TRANSFER_SYNTAX_UID) {
                transferSyntax = new String(meta.readValue(element.length), StandardCharsets.US_ASCII)
                        .replace('\0', ' ').trim();
            } else {
                meta.skip(element.length);
            }
        }

        ElementInput data = datasetInput(in, transferSyntax);
        log.trace("Dataset encoding: preamble={}, transferSyntax={}, bigEndian={}, explicitVr={}",
                hasPreamble, transferSyntax, data.bigEndian, data.explicitVr);

        DicomHeader header = new DicomHeader(data.bigEndian);
        while (!data.atEnd()) {
            int tag = data.peekTag();
            if (Integer.compareUnsigned(tag, DicomTag.LAST_READ) > 0) {
                break;
            }
            ElementHeader element = data.readHeader();
            header.countElement();
            if (element.length == UNDEFINED_LENGTH) {
                data.skipSequence(0);
            } else if (KEPT_TAGS.contains(element.tag)) {
                if (element.length > MAX_VALUE_LENGTH) {
                    throw new DicomStreamException("Value of " + DicomTag.toString(element.tag)
                            + " is " + element.length + " bytes long");
                }
                header.put(element.tag, element.vr, data.readValue(element.length));
            } else {
                data.skip(element.length);
            }
        }
        return header;
    }

    private static boolean skipPreamble(BufferedInputStream in) throws IOException {
        in.mark(PREAMBLE_LENGTH + 4);
        byte[] head = in.readNBytes(PREAMBLE_LENGTH + 4);
        if (head.length == PREAMBLE_LENGTH + 4
                && head[128] == 'D' && head[129] == 'I' && head[130] == 'C' && head[131] == 'M') {
            return true;
        }
        in.reset();
        return false;
    }

    private static ElementInput datasetInput(BufferedInputStream in, String transferSyntax) throws IOException {
        if (transferSyntax == null || transferSyntax.isEmpty()) {
            return guessEncoding(in);
        }
        switch (transferSyntax) {
            case DicomTag.IMPLICIT_VR_LITTLE_ENDIAN:
                return new ElementInput(in, false, false);
            case DicomTag.EXPLICIT_VR_BIG_ENDIAN:
                return new ElementInput(in, true, true);
            case DicomTag.DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN:
                InputStream inflated = new InflaterInputStream(in, new Inflater(true));
                return new ElementInput(new BufferedInputStream(inflated), false, true);
            default:
                return new ElementInput(in, false, true);
        }
    }

    /**
     * Little endian is assumed. A first element outside the groups a dataset
     * can start with means the stream is not DICOM.
     */
    private static ElementInput guessEncoding(BufferedInputStream in) throws IOException {
        in.mark(6);
        byte[] head = in.readNBytes(6);
        in.reset();
        if (head.length == 0) {
            return new ElementInput(in, false, true);
        }
        if (head.length < 6) {
            throw new EOFException("Stream ends inside the first element");
        }
        int group = (head[0] & 0xFF) | ((head[1] & 0xFF) << 8);
        if (group < 0x0008 || group > 0x0028 || (group & 1) != 0) {
            throw new DicomStreamException(String.format("Not a DICOM stream: first group %04X", group));
        }
        boolean explicitVr = isUpperCase(head[4]) && isUpperCase(head[5]);
        return new ElementInput(in, false, explicitVr);
    }

    private static boolean isUpperCase(byte b) {
        return b >= 'A' && b <= 'Z';
    }

    private static final class ElementHeader {
        private final int tag;
        private final String vr;
        private final int length;

        private ElementHeader(int tag, String vr, int length) {
            this.tag = tag;
            this.vr = vr;
            this.length = length;
        }
    }

    /**
     * Endian- and VR-aware reads over a buffered stream.
     */
    private static final class ElementInput {
        private final BufferedInputStream in;
        private final boolean bigEndian;
        private final boolean explicitVr;

        private ElementInput(BufferedInputStream in, boolean bigEndian, boolean explicitVr) {
            this.in = in;
            this.bigEndian = bigEndian;
            this.explicitVr = explicitVr;
        }

        boolean atEnd() throws IOException {
            in.mark(1);
            int b = in.read();
            in.reset();
            return b < 0;
        }

        int peekGroup() throws IOException {
            in.mark(2);
            byte[] b = in.readNBytes(2);
            in.reset();
            return b.length < 2 ? -1 : toUShort(b[0], b[1]);
        }

        int peekTag() throws IOException {
            in.mark(4);
            int tag = readTag();
            in.reset();
            return tag;
        }

        ElementHeader readHeader() throws IOException {
            int tag = readTag();
            if (DicomTag.group(tag) == 0xFFFE) {
                return new ElementHeader(tag, null, readInt());
            }
            String vr = null;
            int length;
            if (explicitVr) {
                byte c0 = readByte();
                byte c1 = readByte();
                if (!isUpperCase(c0) || !isUpperCase(c1)) {
                    throw new DicomStreamException("Invalid VR in element " + DicomTag.toString(tag));
                }
                vr = new String(new byte[]{c0, c1}, StandardCharsets.US_ASCII);
                if (LONG_LENGTH_VRS.contains(vr)) {
                    skip(2);
                    length = readInt();
                } else {
                    length = readUShort();
                }
            } else {
                length = readInt();
            }
            if (length < 0 && length != UNDEFINED_LENGTH) {
                throw new DicomStreamException("Invalid value length in element " + DicomTag.toString(tag));
            }
            return new ElementHeader(tag, vr, length);
        }

        /**
         * Skip items up to and including the sequence delimiter.
         * Item headers are read after the sequence element header.
         */
        void skipSequence(int depth) throws IOException {
            if (depth > MAX_NESTING) {
                throw new DicomStreamException("Sequences nested deeper than " + MAX_NESTING);
            }
            while (true) {
                int tag = readTag();
                int length = readInt();
                if (tag == DicomTag.SEQUENCE_DELIMITATION) {
                    return;
                }
                if (tag != DicomTag.ITEM) {
                    throw new DicomStreamException("Expected item in sequence, found " + DicomTag.toString(tag));
                }
                if (length == UNDEFINED_LENGTH) {
                    skipItem(depth);
                } else {
                    skip(Integer.toUnsignedLong(length));
                }
            }
        }

        private void skipItem(int depth) throws IOException {
            while (true) {
                ElementHeader element = readHeader();
                if (element.tag == DicomTag.ITEM_DELIMITATION) {
                    return;
                }
                if (element.length == UNDEFINED_LENGTH) {
                    skipSequence(depth + 1);
                } else {
                    skip(element.length);
                }
            }
        }

        byte[] readValue(int length) throws IOException {
            byte[] value = in.readNBytes(length);
            if (value.length < length) {
                throw new EOFException("Stream ends inside a value of " + length + " bytes");
            }
            return value;
        }

        void skip(long count) throws IOException {
            long remaining = count;
            while (remaining > 0) {
                long skipped = in.skip(remaining);
                if (skipped > 0) {
                    remaining -= skipped;
                } else if (in.read() < 0) {
                    throw new EOFException("Stream ends " + remaining + " bytes short");
                } else {
                    remaining--;
                }
            }
        }

        private int readTag() throws IOException {
            int group = readUShort();
            int element = readUShort();
            return (group << 16) | element;
        }

        private int readUShort() throws IOException {
            byte b0 = readByte();
            byte b1 = readByte();
            return toUShort(b0, b1);
        }

        private int readInt() throws IOException {
            int lo = readUShort();
            int hi = readUShort();
            return bigEndian ? (lo << 16) | hi : (hi << 16) | lo;
        }

        private int toUShort(byte b0, byte b1) {
            return bigEndian
                    ? ((b0 & 0xFF) << 8) | (b1 & 0xFF)
                    : (b0 & 0xFF) | ((b1 & 0xFF) << 8);
        }

        private byte readByte() throws IOException {
            int b = in.read();
            if (b < 0) {
                throw new EOFException("Unexpected end of stream");
            }
            return (byte) b;
        }
    }
}
