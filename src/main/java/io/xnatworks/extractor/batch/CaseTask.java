/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.batch;

import java.nio.file.Path;

/**
 * One case to process: its directory and the ProjectID assigned before dispatch.
 */
public final class CaseTask {

    private final String caseName;
    private final Path caseDir;
    private final int projectId;

    public CaseTask(String caseName, Path caseDir, int projectId) {
        this.caseName = caseName;
        this.caseDir = caseDir;
        this.projectId = projectId;
    }

    public static CaseTask of(Path caseDir, int projectId) {
        return new CaseTask(caseDir.getFileName().toString(), caseDir, projectId);
    }

    public String getCaseName() { return caseName; }
    public Path getCaseDir() { return caseDir; }
    public int getProjectId() { return projectId; }

    @Override
    public String toString() {
        return caseName + " (ProjectID " + projectId + ")";
    }
}
