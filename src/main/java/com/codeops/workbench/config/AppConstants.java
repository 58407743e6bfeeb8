package com.codeops.workbench.config;

/**
 * Application-wide constants for the CodeOps-Workbench store.
 * Centralizes fixed identifiers, default names and document format metadata.
 */
public final class AppConstants {

    private AppConstants() {}

    /** Id of the root folder present in every collection. */
    public static final String ROOT_FOLDER_ID = "root";

    /** Display name given to a newly constructed root folder. */
    public static final String ROOT_FOLDER_NAME = "Root";

    /** Id of the always-present scratch collection. */
    public static final String SCRATCH_COLLECTION_ID = "scratch";

    /** Display name of the scratch collection. */
    public static final String SCRATCH_COLLECTION_NAME = "Scratches";

    /** Description of the scratch collection. */
    public static final String SCRATCH_COLLECTION_DESCRIPTION = "A collection that holds scratch requests";

    /** Name of the scratch collection's root folder. */
    public static final String SCRATCH_ROOT_FOLDER_NAME = "Scratch";

    /** Format tag of native export documents. */
    public static final String EXPORT_FORMAT = "native";

    /** Version written into native export documents. */
    public static final String EXPORT_VERSION = "1.0.0";

    /** Name used when an imported document has none and no override is given. */
    public static final String DEFAULT_COLLECTION_NAME = "Untitled Collection";

    /** Name given by the normalizer to folders with a blank name. */
    public static final String DEFAULT_FOLDER_NAME = "Untitled Folder";

    /** Name of folders created during a merge when the document does not name them. */
    public static final String IMPORTED_FOLDER_NAME = "Imported Folder";

    /** Name given to new requests created without one. */
    public static final String DEFAULT_REQUEST_NAME = "New Request";

    /** Separator between method and url in a request signature. */
    public static final String SIGNATURE_SEPARATOR = "::";

    /** Replacement written over secrets in sanitized output. */
    public static final String REDACTED = "";

    /** Directory under the data dir that holds collection files. */
    public static final String COLLECTIONS_DIR = "collections";

    /** File name of the collections index inside {@link #COLLECTIONS_DIR}. */
    public static final String INDEX_FILE_NAME = ".index.json";

    /** Current schema version of the collections index file. */
    public static final int INDEX_SCHEMA_VERSION = 2;

    /** Current schema version of a collection file. */
    public static final int COLLECTION_SCHEMA_VERSION = 1;
}
