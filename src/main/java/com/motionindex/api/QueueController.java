package com.motionindex.api;

import com.motionindex.processing.queue.QueueManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/queues")
@Tag(name = "Queues", description = "Work queue statistics")
public class QueueController {

    private final QueueManager queueManager;

    public QueueController(QueueManager queueManager) {
        this.queueManager = queueManager;
    }

    @GetMapping
    @Operation(summary = "Statistics and health of all work queues")
    public ResponseEntity<Map<String, Object>> getQueues() {
        boolean healthy = queueManager.isHealthy();
        Map<String, Object> response = new HashMap<>();
        response.put("healthy", healthy);
        response.put("queues", queueManager.getAllStats());
        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }
}
