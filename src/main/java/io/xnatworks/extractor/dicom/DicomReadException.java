/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.dicom;

/**
 * Thrown when a file cannot be decoded as a DICOM dataset.
 */
public class DicomReadException extends Exception {

    public DicomReadException(String message) {
        super(message);
    }

    public DicomReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
