package com.codeops.workbench;

import com.codeops.workbench.config.AppConstants;
import com.codeops.workbench.dto.request.CreateCollectionRequest;
import com.codeops.workbench.dto.response.CollectionSummaryResponse;
import com.codeops.workbench.service.CollectionService;
import com.codeops.workbench.storage.StorageManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the full context against a temporary data directory and checks that a created
 * collection reaches disk.
 */
@SpringBootTest
class WorkbenchApplicationTest {

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void dataDir(DynamicPropertyRegistry registry) {
        registry.add("codeops.workbench.data-dir", () -> dataDir.toString());
    }

    @Autowired
    private CollectionService collectionService;

    @Autowired
    private StorageManager storageManager;

    @Test
    void context_createsAndPersistsCollection() {
        CollectionSummaryResponse created = collectionService.addCollection(
                new CreateCollectionRequest("Smoke", "context test"));

        storageManager.flush();

        assertThat(collectionService.listCollections()).extracting(CollectionSummaryResponse::id)
                .startsWith(AppConstants.SCRATCH_COLLECTION_ID)
                .contains(created.id());
        Path collections = dataDir.resolve(AppConstants.COLLECTIONS_DIR);
        assertThat(Files.exists(collections.resolve(created.id() + ".json"))).isTrue();
        assertThat(Files.exists(collections.resolve(AppConstants.INDEX_FILE_NAME))).isTrue();
    }
}
