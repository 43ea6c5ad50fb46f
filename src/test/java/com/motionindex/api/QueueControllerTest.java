package com.motionindex.api;

import com.motionindex.processing.queue.QueueManager;
import com.motionindex.processing.queue.QueueStats;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Collections;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QueueController.class)
class QueueControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private QueueManager queueManager;

    @Test
    void testHealthyQueues() throws Exception {
        QueueStats indexing = new QueueStats("indexing", "search_document", 4, 300, 6, 2, 120, 110, 3, 7, 1, true);
        when(queueManager.isHealthy()).thenReturn(true);
        when(queueManager.getAllStats()).thenReturn(Map.of("indexing", indexing));

        mockMvc.perform(get("/api/queues"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.healthy").value(true))
                .andExpect(jsonPath("$.queues.indexing.depth").value(4))
                .andExpect(jsonPath("$.queues.indexing.capacity").value(300))
                .andExpect(jsonPath("$.queues.indexing.rejected").value(1));
    }

    @Test
    void testUnhealthyQueuesReturnServiceUnavailable() throws Exception {
        when(queueManager.isHealthy()).thenReturn(false);
        when(queueManager.getAllStats()).thenReturn(Collections.emptyMap());

        mockMvc.perform(get("/api/queues"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.healthy").value(false));
    }
}
