package com.motionindex.api.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local search index for development and tests.
 * Only loads when app.search.mode=local (or when the property is missing, as it's the default).
 */
@Service
@ConditionalOnProperty(name = "app.search.mode", havingValue = "local", matchIfMissing = true)
public class InMemorySearchIndexService implements SearchIndexService {

    private static final Logger logger = LoggerFactory.getLogger(InMemorySearchIndexService.class);

    private final Map<String, SearchDocument> documents = new ConcurrentHashMap<>();

    @Override
    public String indexDocument(SearchDocument document) throws IOException {
        String error = validate(document);
        if (error != null) {
            throw new IOException(error);
        }
        document.setIndexedAt(Instant.now());
        documents.put(document.getId(), document);
        logger.debug("Indexed document {}", document.getId());
        return document.getId();
    }

    @Override
    public BulkIndexResult bulkIndex(List<SearchDocument> batch) {
        Map<String, String> failures = new HashMap<>();
        Map<String, String> indexIds = new HashMap<>();
        int indexed = 0;
        int failed = 0;
        Instant now = Instant.now();

        for (SearchDocument document : batch) {
            String error = validate(document);
            if (error != null) {
                failed++;
                if (document != null && document.getId() != null) {
                    failures.put(document.getId(), error);
                }
                continue;
            }
            document.setIndexedAt(now);
            documents.put(document.getId(), document);
            indexIds.put(document.getId(), document.getId());
            indexed++;
        }

        logger.info("Bulk indexed {} documents ({} failed)", indexed, failed);
        return new BulkIndexResult(indexed, failed, failures, indexIds);
    }

    public Optional<SearchDocument> get(String id) {
        return Optional.ofNullable(documents.get(id));
    }

    public int size() {
        return documents.size();
    }

    private static String validate(SearchDocument document) {
        if (document == null || document.getId() == null || document.getId().isBlank()) {
            return "document ID is required";
        }
        if (document.getText() == null || document.getText().isBlank()) {
            return "document text is empty";
        }
        return null;
    }
}
