package com.codeops.workbench.storage.migration;

import com.codeops.workbench.config.AppConstants;

public enum DocumentKind {

    INDEX(AppConstants.INDEX_SCHEMA_VERSION),
    COLLECTION(AppConstants.COLLECTION_SCHEMA_VERSION);

    private final int currentVersion;

    DocumentKind(int currentVersion) {
        this.currentVersion = currentVersion;
    }

    public int currentVersion() {
        return currentVersion;
    }
}
