package com.motionindex.api.search;

import java.io.IOException;
import java.util.List;

/**
 * Write side of the document search index.
 */
public interface SearchIndexService {

    /**
     * Indexes (or replaces) a single document.
     *
     * @return the ID the index stored the document under
     * @throws IOException if the write fails
     */
    String indexDocument(SearchDocument document) throws IOException;

    /**
     * Indexes many documents in one call. Per-document failures are reported in the
     * result keyed by document ID; an exception means the whole call failed.
     */
    BulkIndexResult bulkIndex(List<SearchDocument> documents) throws IOException;
}
