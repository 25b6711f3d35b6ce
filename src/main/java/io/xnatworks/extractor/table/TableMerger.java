/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Concatenates case tables in input order.
 */
public final class TableMerger {

    private TableMerger() {
    }

    public static MergedTable merge(Collection<CaseTable> tables) {
        List<Map<String, String>> rows = new ArrayList<>();
        for (CaseTable table : tables) {
            rows.addAll(table.getRows());
        }
        return new MergedTable(rows);
    }
}
