/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.dicom;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Raw values of the header elements kept by {@link DicomHeaderParser}.
 */
public class DicomHeader {

    private final Map<Integer, Element> elements = new HashMap<>();
    private final boolean bigEndian;
    private int elementCount;

    DicomHeader(boolean bigEndian) {
        this.bigEndian = bigEndian;
    }

    void put(int tag, String vr, byte[] value) {
        elements.put(tag, new Element(vr, value));
    }

    void countElement() {
        elementCount++;
    }

    /**
     * Number of dataset elements seen, kept or not. File meta elements are not counted.
     */
    public int getElementCount() {
        return elementCount;
    }

    public boolean isEmpty() {
        return elementCount == 0;
    }

    public boolean contains(int tag) {
        Element element = elements.get(tag);
        return element != null && element.value.length > 0;
    }

    /**
     * Decoded string value with DICOM padding (trailing spaces and NULs) removed.
     * Multi-valued elements are returned as stored, backslashes included.
     */
    public String getString(int tag) {
        Element element = elements.get(tag);
        if (element == null) {
            return null;
        }
        String value = new String(element.value, charset());
        int end = value.length();
        while (end > 0 && (value.charAt(end - 1) == ' ' || value.charAt(end - 1) == '\0')) {
            end--;
        }
        return value.substring(0, end);
    }

    /**
     * Integer value of a binary (US/UL) or decimal string (IS) element.
     *
     * @return the value, or null when the element is absent or empty
     * @throws NumberFormatException if a string value is not a decimal integer
     */
    public Integer getInt(int tag) {
        Element element = elements.get(tag);
        if (element == null || element.value.length == 0) {
            return null;
        }
        byte[] b = element.value;
        boolean binary = element.vr == null || "US".equals(element.vr) || "UL".equals(element.vr)
                || "SS".equals(element.vr) || "SL".equals(element.vr);
        if (binary && b.length == 2) {
            int v = bigEndian
                    ? ((b[0] & 0xFF) << 8) | (b[1] & 0xFF)
                    : (b[0] & 0xFF) | ((b[1] & 0xFF) << 8);
            return "SS".equals(element.vr) ? (int) (short) v : v;
        }
        if (binary && b.length == 4) {
            return bigEndian
                    ? ((b[0] & 0xFF) << 24) | ((b[1] & 0xFF) << 16) | ((b[2] & 0xFF) << 8) | (b[3] & 0xFF)
                    : (b[0] & 0xFF) | ((b[1] & 0xFF) << 8) | ((b[2] & 0xFF) << 16) | ((b[3] & 0xFF) << 24);
        }
        String text = getString(tag);
        int sep = text.indexOf('\\');
        return Integer.valueOf((sep >= 0 ? text.substring(0, sep) : text).trim());
    }

    private Charset charset() {
        Element element = elements.get(DicomTag.SPECIFIC_CHARACTER_SET);
        if (element == null) {
            return StandardCharsets.ISO_8859_1;
        }
        String term = new String(element.value, StandardCharsets.US_ASCII).trim();
        if (term.contains("ISO_IR 192")) {
            return StandardCharsets.UTF_8;
        }
        if (term.contains("GB18030") || term.contains("GBK")) {
            return Charset.forName("GB18030");
        }
        return StandardCharsets.ISO_8859_1;
    }

    private static final class Element {
        private final String vr;
        private final byte[] value;

        private Element(String vr, byte[] value) {
            this.vr = vr;
            this.value = value;
        }
    }
}
