package com.motionindex.api.storage;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Object storage for original documents (local filesystem or GCS).
 * Paths are logical, slash separated keys such as {@code documents/{documentId}/{filename}}.
 */
public interface StorageService {

    /**
     * Writes the content under the given path, replacing any existing object.
     *
     * @param path        logical storage path
     * @param content     content stream; read fully but not closed
     * @param contentType MIME type, may be null
     * @param metadata    object metadata (document ID, original filename, classification tags)
     * @return where the object ended up
     * @throws IOException if the write fails
     */
    StorageResult upload(String path, InputStream content, String contentType, Map<String, String> metadata) throws IOException;

    /**
     * Opens a stored object for reading. Accepts a logical path or a URL returned by {@link #upload}.
     *
     * @throws IOException if the object is missing or cannot be read
     */
    InputStream download(String path) throws IOException;
}
