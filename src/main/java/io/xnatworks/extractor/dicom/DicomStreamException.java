/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.dicom;

import java.io.IOException;

/**
 * Malformed DICOM stream: bad magic, bad element header or nesting.
 */
public class DicomStreamException extends IOException {

    public DicomStreamException(String message) {
        super(message);
    }
}
