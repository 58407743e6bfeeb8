package com.codeops.workbench.storage.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CollectionFolderMigrationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CollectionFolderMigration migration = new CollectionFolderMigration();

    @Test
    void migrate_addsFoldersAndDropsRequestIndex() throws Exception {
        JsonNode content = objectMapper.readTree("{\"id\":\"c\",\"requestIndex\":{}}");

        JsonNode result = migration.migrate(new MigrateContext("c.json", 0, content));

        assertThat(result.path("folders").isObject()).isTrue();
        assertThat(result.has("requestIndex")).isFalse();
    }

    @Test
    void migrate_existingFolders_kept() throws Exception {
        JsonNode content = objectMapper.readTree("{\"folders\":{\"root\":{\"name\":\"Root\"}}}");

        JsonNode result = migration.migrate(new MigrateContext("c.json", 0, content));

        assertThat(result.path("folders").path("root").path("name").asText()).isEqualTo("Root");
    }

    @Test
    void migrate_nonObject_passedThrough() throws Exception {
        JsonNode content = objectMapper.readTree("[1]");

        assertThat(migration.migrate(new MigrateContext("c.json", 0, content))).isSameAs(content);
    }
}
