package com.motionindex.processing.indexing;

import com.motionindex.api.search.SearchDocument;
import com.motionindex.api.search.SearchIndexService;
import com.motionindex.processing.queue.QueueItem;
import com.motionindex.processing.queue.QueueProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes one queued document to the search index. Bound to the {@value #QUEUE_NAME} queue;
 * a thrown exception lets the queue retry the item.
 */
@Component
public class IndexingQueueProcessor implements QueueProcessor<SearchDocument> {

    private static final Logger logger = LoggerFactory.getLogger(IndexingQueueProcessor.class);

    public static final String QUEUE_NAME = "indexing";
    public static final String ITEM_TYPE = "search_document";

    private final SearchIndexService searchIndexService;

    public IndexingQueueProcessor(SearchIndexService searchIndexService) {
        this.searchIndexService = searchIndexService;
    }

    @Override
    public void process(QueueItem<SearchDocument> item) throws Exception {
        SearchDocument document = item.getPayload();
        String indexId = searchIndexService.indexDocument(document);
        logger.debug("Indexed queued document {} as {} (attempt {})", document.getId(), indexId, item.getRetryCount() + 1);
    }
}
