package com.hydralog.backend.logging.controller;

import com.hydralog.backend.auth.security.AuthContext;
import com.hydralog.backend.logging.dto.QueueStateResponse;
import com.hydralog.backend.logging.queue.DrainResult;
import com.hydralog.backend.logging.queue.OfflineOperationQueue;
import com.hydralog.backend.logging.queue.QueuedOperation;
import com.hydralog.backend.logging.service.OfflineAwareLoggingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Objects;

/** The caller's own queued operations: inspect, sync now, retry a failed one, drop one. */
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/treatments/queue")
public class OfflineQueueController {

    private final AuthContext auth;
    private final OfflineOperationQueue queue;
    private final OfflineAwareLoggingService submissions;

    @GetMapping
    public QueueStateResponse list() {
        List<QueuedOperation> ops = queue.operationsFor(auth.requireUserId());
        return new QueueStateResponse(ops.size(), ops);
    }

    @PostMapping("/sync")
    public DrainResult sync() {
        return submissions.syncNow(auth.requireUserId());
    }

    @PostMapping("/{operationId}/retry")
    public ResponseEntity<Void> retry(@PathVariable String operationId) {
        if (!owns(operationId) || !queue.retry(operationId)) return ResponseEntity.notFound().build();
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{operationId}")
    public ResponseEntity<Void> remove(@PathVariable String operationId) {
        if (!owns(operationId) || !queue.remove(operationId)) return ResponseEntity.notFound().build();
        return ResponseEntity.noContent().build();
    }

    private boolean owns(String operationId) {
        Long uid = auth.requireUserId();
        return queue.find(operationId)
                .map(op -> Objects.equals(uid, op.command().userId()))
                .orElse(false);
    }
}
