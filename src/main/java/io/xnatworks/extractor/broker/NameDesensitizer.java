/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.broker;

import io.xnatworks.extractor.table.CaseTable;
import io.xnatworks.extractor.table.FixedColumns;
import io.xnatworks.extractor.table.MergedTable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Replaces patient names with a short SHA-256 based pseudonym, e.g.
 * "hash:3f2a9c01d4e5b6a7".
 *
 * <p>The digest is unsalted, so the same name always yields the same
 * pseudonym across runs and machines. Outputs stay joinable, but anyone able
 * to guess a name can confirm it by hashing.</p>
 */
public final class NameDesensitizer {

    public static final String PREFIX = "hash:";
    public static final int HEX_LENGTH = 16;

    private NameDesensitizer() {
    }

    /**
     * @return the pseudonym, or the input unchanged when it is null or empty
     */
    public static String desensitize(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        byte[] hash = sha256().digest(name.getBytes(StandardCharsets.UTF_8));
        StringBuilder hex = new StringBuilder(PREFIX);
        for (int i = 0; i < HEX_LENGTH / 2; i++) {
            hex.append(String.format("%02x", hash[i]));
        }
        return hex.toString();
    }

    public static CaseTable desensitize(CaseTable table) {
        return table.mapColumn(FixedColumns.PATIENT_NAME, NameDesensitizer::desensitize);
    }

    public static MergedTable desensitize(MergedTable table) {
        return table.mapColumn(FixedColumns.PATIENT_NAME, NameDesensitizer::desensitize);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to provide SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
