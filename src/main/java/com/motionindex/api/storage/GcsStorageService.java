package com.motionindex.api.storage;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.google.cloud.storage.StorageOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.util.HashMap;
import java.util.Map;

/**
 * Stores documents in a Google Cloud Storage bucket.
 * Supports both real GCS and the local emulator (via STORAGE_EMULATOR_HOST).
 * Only loads when app.storage.mode=gcs.
 */
@Service
@ConditionalOnProperty(name = "app.storage.mode", havingValue = "gcs")
public class GcsStorageService implements StorageService {

    private static final Logger logger = LoggerFactory.getLogger(GcsStorageService.class);

    private final Storage storage;
    private final String bucketName;

    public GcsStorageService(@Value("${gcs.bucket-name:motion-index-documents}") String bucketName) {
        this.bucketName = bucketName;
        // Uses Application Default Credentials, or the emulator when STORAGE_EMULATOR_HOST is set
        this.storage = StorageOptions.getDefaultInstance().getService();

        String emulatorHost = System.getenv("STORAGE_EMULATOR_HOST");
        if (emulatorHost != null && !emulatorHost.isEmpty()) {
            logger.info("Using GCS emulator at: {}", emulatorHost);
        }
        logger.info("GCS storage service initialized with bucket: {}", bucketName);
    }

    @Override
    public StorageResult upload(String path, InputStream content, String contentType,
                                Map<String, String> metadata) throws IOException {
        String objectName = objectName(path);
        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucketName, objectName))
                .setContentType(contentType)
                .setMetadata(metadata != null ? new HashMap<>(metadata) : null)
                .build();

        logger.debug("Uploading file to GCS: gs://{}/{}", bucketName, objectName);
        try {
            Blob blob = storage.createFrom(blobInfo, content);
            String gcsPath = "gs://" + bucketName + "/" + objectName;
            logger.info("Successfully uploaded file to GCS: {}", gcsPath);
            return new StorageResult(objectName, gcsPath, blob.getSize() != null ? blob.getSize() : -1L);
        } catch (StorageException e) {
            logger.error("Failed to upload file to GCS: gs://{}/{}", bucketName, objectName, e);
            throw new IOException("Failed to upload file to GCS: " + objectName, e);
        }
    }

    @Override
    public InputStream download(String path) throws IOException {
        String objectName = objectName(path);
        try {
            Blob blob = storage.get(BlobId.of(bucketName, objectName));
            if (blob == null) {
                throw new FileNotFoundException("Object not found: gs://" + bucketName + "/" + objectName);
            }
            return Channels.newInputStream(blob.reader());
        } catch (StorageException e) {
            throw new IOException("Failed to download gs://" + bucketName + "/" + objectName, e);
        }
    }

    private String objectName(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Storage path is required");
        }
        String prefix = "gs://" + bucketName + "/";
        return path.startsWith(prefix) ? path.substring(prefix.length()) : path;
    }
}
