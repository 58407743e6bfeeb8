package com.codeops.workbench.storage.migration;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Upgrades stored JSON content of one document kind to {@link #version()}.
 * Migrations run in ascending version order for every stored version below theirs.
 */
public interface StorageMigration {

    /** Document kind this migration applies to. */
    DocumentKind kind();

    /** Schema version produced by this migration. */
    int version();

    /**
     * Transforms content of an older version.
     *
     * @param context the stored content and its version
     * @return the migrated content
     */
    JsonNode migrate(MigrateContext context);
}
