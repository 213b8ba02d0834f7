package com.hydralog.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * application.yml:
 * app.logging.queue.*
 */
@ConfigurationProperties(prefix = "app.logging.queue")
public class OfflineQueueProperties {

    /** enqueue is rejected at this size */
    private int hardCap = 200;

    /** enqueue succeeds but reports a warning at this size */
    private int softCap = 50;

    /** entries older than this are dropped on load, whatever their status */
    private Duration ttl = Duration.ofDays(30);

    private int maxAttempts = 5;

    private Duration initialBackoff = Duration.ofSeconds(1);
    private Duration maxBackoff = Duration.ofSeconds(30);

    /** background drain job (@Scheduled reads fixed-delay/initial-delay through placeholders) */
    private boolean syncEnabled = true;
    private Duration fixedDelay = Duration.ofMinutes(1);
    private Duration initialDelay = Duration.ofSeconds(30);

    // ===== getters/setters =====
    public int getHardCap() { return hardCap; }
    public void setHardCap(int hardCap) { this.hardCap = hardCap; }

    public int getSoftCap() { return softCap; }
    public void setSoftCap(int softCap) { this.softCap = softCap; }

    public Duration getTtl() { return ttl; }
    public void setTtl(Duration ttl) { this.ttl = ttl; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public Duration getInitialBackoff() { return initialBackoff; }
    public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

    public Duration getMaxBackoff() { return maxBackoff; }
    public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }

    public boolean isSyncEnabled() { return syncEnabled; }
    public void setSyncEnabled(boolean syncEnabled) { this.syncEnabled = syncEnabled; }

    public Duration getFixedDelay() { return fixedDelay; }
    public void setFixedDelay(Duration fixedDelay) { this.fixedDelay = fixedDelay; }

    public Duration getInitialDelay() { return initialDelay; }
    public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
}
