package com.motionindex.api.storage;

/**
 * Location of an uploaded object.
 */
public class StorageResult {

    private final String path;
    private final String url;
    private final long size;

    public StorageResult(String path, String url, long size) {
        this.path = path;
        this.url = url;
        this.size = size;
    }

    public String getPath() {
        return path;
    }

    public String getUrl() {
        return url;
    }

    public long getSize() {
        return size;
    }
}
