package com.codeops.workbench.storage.migration;

import com.codeops.workbench.config.AppConstants;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Index v2: every entry gets an {@code order}. The scratch collection moves to the front
 * with order 0; other entries keep an existing order or are numbered from 1 in file order.
 */
@Component
@Slf4j
public class IndexOrderMigration implements StorageMigration {

    @Override
    public DocumentKind kind() {
        return DocumentKind.INDEX;
    }

    @Override
    public int version() {
        return 2;
    }

    @Override
    public JsonNode migrate(MigrateContext context) {
        List<ObjectNode> entries = new ArrayList<>();
        if (context.content() != null && context.content().isArray()) {
            context.content().forEach(node -> {
                if (node.isObject()) {
                    entries.add((ObjectNode) node);
                }
            });
        }
        entries.sort(Comparator.comparing(entry -> !isScratch(entry)));

        ArrayNode result = JsonNodeFactory.instance.arrayNode();
        int seq = 0;
        for (ObjectNode entry : entries) {
            if (isScratch(entry)) {
                entry.put("order", 0);
            } else {
                seq++;
                if (!entry.hasNonNull("order")) {
                    entry.put("order", seq);
                }
            }
            result.add(entry);
        }
        log.info("Migrated {} entries of {} to index version {}", entries.size(), context.fileName(), version());
        return result;
    }

    private static boolean isScratch(JsonNode entry) {
        return AppConstants.SCRATCH_COLLECTION_ID.equals(entry.path("id").asText(null));
    }
}
