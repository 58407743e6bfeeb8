package com.codeops.workbench.storage.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IndexOrderMigrationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final IndexOrderMigration migration = new IndexOrderMigration();

    @Test
    void migrate_scratchFirstAndOrdersAssigned() throws Exception {
        JsonNode content = objectMapper.readTree(
                "[{\"id\":\"a\"},{\"id\":\"b\",\"order\":7},{\"id\":\"scratch\",\"order\":4},{\"id\":\"c\"}]");

        JsonNode result = migration.migrate(new MigrateContext(".index.json", 1, content));

        assertThat(result).hasSize(4);
        assertThat(result.get(0).path("id").asText()).isEqualTo("scratch");
        assertThat(result.get(0).path("order").asInt()).isZero();
        assertThat(result.get(1).path("order").asInt()).isEqualTo(1);
        assertThat(result.get(2).path("order").asInt()).isEqualTo(7);
        assertThat(result.get(3).path("order").asInt()).isEqualTo(3);
    }

    @Test
    void migrate_nonArrayContent_yieldsEmptyIndex() {
        JsonNode result = migration.migrate(new MigrateContext(".index.json", 1, null));

        assertThat(result.isArray()).isTrue();
        assertThat(result).isEmpty();
    }

    @Test
    void kindAndVersion() {
        assertThat(migration.kind()).isEqualTo(DocumentKind.INDEX);
        assertThat(migration.version()).isEqualTo(DocumentKind.INDEX.currentVersion());
    }
}
