package com.hydralog.backend.logging.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Background drain of the offline queue, standing in for "connectivity came back". */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "app.logging.queue", name = "sync-enabled", havingValue = "true", matchIfMissing = true)
public class OfflineQueueSyncJob {

    private final OfflineOperationQueue queue;

    @Scheduled(
            fixedDelayString = "${app.logging.queue.fixed-delay:PT1M}",
            initialDelayString = "${app.logging.queue.initial-delay:PT30S}"
    )
    public void runOnce() {
        if (queue.pending().isEmpty()) return;

        DrainResult result = queue.drainPending();
        if (result.hasFailures()) {
            log.warn("background sync finished with failures: ok={} failed={} ids={}",
                    result.successCount(), result.failureCount(), result.failedOperationIds());
        } else if (result.successCount() > 0) {
            log.info("background sync ok={}", result.successCount());
        }
    }
}
