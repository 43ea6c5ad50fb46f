package com.motionindex.api.storage;

import java.util.regex.Pattern;

/**
 * Builds storage keys for documents.
 */
public final class StoragePaths {

    private static final Pattern INVALID_FILENAME_CHARS = Pattern.compile("[^a-zA-Z0-9._-]");
    private static final String DOCUMENTS_PREFIX = "documents";

    private StoragePaths() {
        // Utility class
    }

    /**
     * {@code documents/{documentId}/{sanitized filename}}.
     */
    public static String forDocument(String documentId, String fileName) {
        return DOCUMENTS_PREFIX + "/" + sanitize(documentId) + "/" + sanitize(fileName);
    }

    /**
     * Replaces path separators and other unsafe characters, and neutralizes "..".
     */
    public static String sanitize(String name) {
        if (name == null || name.isEmpty()) {
            return "file";
        }
        String sanitized = INVALID_FILENAME_CHARS.matcher(name).replaceAll("_");
        return sanitized.replace("..", "_");
    }
}
