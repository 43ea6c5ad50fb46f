package com.motionindex.api.search;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Outcome of one bulk write. {@code failures} maps document ID to error message,
 * {@code indexIds} maps document ID to the ID assigned by the index.
 */
public class BulkIndexResult {

    private final int indexedCount;
    private final int failedCount;
    private final Map<String, String> failures;
    private final Map<String, String> indexIds;

    public BulkIndexResult(int indexedCount, int failedCount,
                           Map<String, String> failures, Map<String, String> indexIds) {
        this.indexedCount = indexedCount;
        this.failedCount = failedCount;
        this.failures = failures != null ? new HashMap<>(failures) : new HashMap<>();
        this.indexIds = indexIds != null ? new HashMap<>(indexIds) : new HashMap<>();
    }

    public int getIndexedCount() {
        return indexedCount;
    }

    public int getFailedCount() {
        return failedCount;
    }

    public Map<String, String> getFailures() {
        return Collections.unmodifiableMap(failures);
    }

    public Map<String, String> getIndexIds() {
        return Collections.unmodifiableMap(indexIds);
    }

    /**
     * True when every reported failure names the document it belongs to.
     */
    public boolean isFullyAttributed() {
        return failedCount == failures.size();
    }
}
