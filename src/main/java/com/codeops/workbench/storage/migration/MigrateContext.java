package com.codeops.workbench.storage.migration;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Input of a {@link StorageMigration}.
 *
 * @param fileName the file being migrated, for logging
 * @param version  the version the content is currently at
 * @param content  the content, owned by the migration
 */
public record MigrateContext(String fileName, int version, JsonNode content) {}
