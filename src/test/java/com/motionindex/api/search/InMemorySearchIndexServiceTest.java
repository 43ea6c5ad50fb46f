package com.motionindex.api.search;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySearchIndexServiceTest {

    private final InMemorySearchIndexService searchIndexService = new InMemorySearchIndexService();

    @Test
    void testIndexDocumentReplacesById() throws Exception {
        searchIndexService.indexDocument(new SearchDocument("doc-1", "first draft"));
        String id = searchIndexService.indexDocument(new SearchDocument("doc-1", "filed version"));

        assertThat(id).isEqualTo("doc-1");
        assertThat(searchIndexService.size()).isEqualTo(1);
        assertThat(searchIndexService.get("doc-1")).hasValueSatisfying(doc -> {
            assertThat(doc.getText()).isEqualTo("filed version");
            assertThat(doc.getIndexedAt()).isNotNull();
        });
    }

    @Test
    void testIndexDocumentRejectsEmptyText() {
        assertThatThrownBy(() -> searchIndexService.indexDocument(new SearchDocument("doc-2", " ")))
                .isInstanceOf(IOException.class)
                .hasMessage("document text is empty");
    }

    @Test
    void testBulkIndexReportsPerDocumentFailures() {
        BulkIndexResult result = searchIndexService.bulkIndex(Arrays.asList(
                new SearchDocument("doc-1", "motion"),
                new SearchDocument("doc-2", ""),
                new SearchDocument(null, "orphan"),
                new SearchDocument("doc-3", "order")));

        assertThat(result.getIndexedCount()).isEqualTo(2);
        assertThat(result.getFailedCount()).isEqualTo(2);
        assertThat(result.getFailures()).containsOnlyKeys("doc-2");
        assertThat(result.getIndexIds()).containsOnlyKeys("doc-1", "doc-3");
        assertThat(result.isFullyAttributed()).isFalse();
        assertThat(searchIndexService.size()).isEqualTo(2);
    }
}
