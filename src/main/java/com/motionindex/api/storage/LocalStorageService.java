package com.motionindex.api.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Stores documents under a directory on the local filesystem.
 * Only loads when app.storage.mode=local (or when the property is missing, as it's the default).
 * Object metadata is not persisted locally.
 */
@Service
@ConditionalOnProperty(name = "app.storage.mode", havingValue = "local", matchIfMissing = true)
public class LocalStorageService implements StorageService {

    private static final Logger logger = LoggerFactory.getLogger(LocalStorageService.class);
    static final String URL_PREFIX = "local://";

    private final Path storageRoot;

    public LocalStorageService(@Value("${app.storage.local-dir:.local-storage}") String localDir) {
        this.storageRoot = Paths.get(localDir).toAbsolutePath().normalize();
        try {
            Files.createDirectories(storageRoot);
            logger.info("Local storage service initialized with directory: {}", storageRoot);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create local storage directory: " + storageRoot, e);
        }
    }

    @Override
    public StorageResult upload(String path, InputStream content, String contentType,
                                Map<String, String> metadata) throws IOException {
        String key = stripPrefix(path);
        Path target = resolve(key);
        Files.createDirectories(target.getParent());

        logger.debug("Uploading to local storage: {}", target);
        try {
            long size = Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
            logger.info("Stored {} bytes at {}{}", size, URL_PREFIX, key);
            return new StorageResult(key, URL_PREFIX + key, size);
        } catch (IOException e) {
            logger.error("Failed to upload file to local storage: {}", target, e);
            throw new IOException("Failed to upload file to local storage: " + key, e);
        }
    }

    @Override
    public InputStream download(String path) throws IOException {
        Path source = resolve(stripPrefix(path));
        if (!Files.isRegularFile(source)) {
            throw new FileNotFoundException("File not found in local storage: " + path);
        }
        logger.debug("Downloading from local storage: {}", source);
        return Files.newInputStream(source);
    }

    private static String stripPrefix(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Storage path is required");
        }
        String key = path.startsWith(URL_PREFIX) ? path.substring(URL_PREFIX.length()) : path;
        while (key.startsWith("/")) {
            key = key.substring(1);
        }
        return key;
    }

    private Path resolve(String key) {
        Path resolved = storageRoot.resolve(key).normalize();
        // The resolved file must stay inside the storage root
        if (!resolved.startsWith(storageRoot) || resolved.equals(storageRoot)) {
            throw new IllegalArgumentException("Path traversal detected: " + key);
        }
        return resolved;
    }
}
