package com.codeops.workbench.storage.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * Collection v1: folder arena and runtime index split. Files written before folders existed
 * get an empty {@code folders} object, leaving root creation and request placement to the
 * normalizer. A persisted {@code requestIndex} is dropped because it is always rebuilt.
 */
@Component
public class CollectionFolderMigration implements StorageMigration {

    @Override
    public DocumentKind kind() {
        return DocumentKind.COLLECTION;
    }

    @Override
    public int version() {
        return 1;
    }

    @Override
    public JsonNode migrate(MigrateContext context) {
        if (context.content() == null || !context.content().isObject()) {
            return context.content();
        }
        ObjectNode collection = (ObjectNode) context.content();
        if (!collection.path("folders").isObject()) {
            collection.set("folders", JsonNodeFactory.instance.objectNode());
        }
        collection.remove("requestIndex");
        return collection;
    }
}
