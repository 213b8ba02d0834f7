package com.hydralog.backend.logging.analytics;

import com.hydralog.backend.logging.error.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Service
public class Slf4jLoggingAnalytics implements LoggingAnalytics {

    @Async("analyticsExecutor")
    @Override
    public void trackLoggingFailure(ErrorKind kind, Map<String, Object> context) {
        log.warn("logging_event status=FAIL errorCode={} context={}", kind, sorted(context));
    }

    @Async("analyticsExecutor")
    @Override
    public void trackFeatureUsed(String feature, Map<String, Object> properties) {
        log.info("logging_event status=OK feature={} props={}", safe(feature), sorted(properties));
    }

    private static Map<String, Object> sorted(Map<String, Object> m) {
        return m == null ? Map.of() : new TreeMap<>(m);
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "UNKNOWN" : s; }
}
