package com.hydralog.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * application.yml:
 * app.logging.write.*, app.logging.match.*, app.logging.duplicate.*,
 * app.logging.validation.*, app.logging.summary.*
 */
@ConfigurationProperties(prefix = "app.logging")
public class TreatmentLoggingProperties {

    private final Write write = new Write();
    private final Match match = new Match();
    private final Duplicate duplicate = new Duplicate();
    private final Validation validation = new Validation();
    private final Summary summary = new Summary();

    public Write getWrite() { return write; }
    public Match getMatch() { return match; }
    public Duplicate getDuplicate() { return duplicate; }
    public Validation getValidation() { return validation; }
    public Summary getSummary() { return summary; }

    public static class Write {
        /** hard ceiling of one atomic unit */
        private int maxOperationsPerUnit = 500;

        public int getMaxOperationsPerUnit() { return maxOperationsPerUnit; }
        public void setMaxOperationsPerUnit(int maxOperationsPerUnit) { this.maxOperationsPerUnit = maxOperationsPerUnit; }
    }

    public static class Match {
        private Duration tolerance = Duration.ofHours(2);

        public Duration getTolerance() { return tolerance; }
        public void setTolerance(Duration tolerance) { this.tolerance = tolerance; }
    }

    public static class Duplicate {
        private Duration window = Duration.ofMinutes(15);

        /** row cap of the narrow store query used when the cache cannot answer */
        private int queryLimit = 10;

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }

        public int getQueryLimit() { return queryLimit; }
        public void setQueryLimit(int queryLimit) { this.queryLimit = queryLimit; }
    }

    public static class Validation {
        /** adds non-blocking medical warnings on top of the structural rules */
        private boolean strict = false;

        public boolean isStrict() { return strict; }
        public void setStrict(boolean strict) { this.strict = strict; }
    }

    public static class Summary {
        private Duration dailyTtl = Duration.ofMinutes(5);
        private Duration weeklyTtl = Duration.ofMinutes(15);
        private Duration monthlyTtl = Duration.ofMinutes(15);
        private long maxEntries = 5_000;

        public Duration getDailyTtl() { return dailyTtl; }
        public void setDailyTtl(Duration dailyTtl) { this.dailyTtl = dailyTtl; }

        public Duration getWeeklyTtl() { return weeklyTtl; }
        public void setWeeklyTtl(Duration weeklyTtl) { this.weeklyTtl = weeklyTtl; }

        public Duration getMonthlyTtl() { return monthlyTtl; }
        public void setMonthlyTtl(Duration monthlyTtl) { this.monthlyTtl = monthlyTtl; }

        public long getMaxEntries() { return maxEntries; }
        public void setMaxEntries(long maxEntries) { this.maxEntries = maxEntries; }
    }
}
