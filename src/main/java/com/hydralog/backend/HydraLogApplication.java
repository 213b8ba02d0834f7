package com.hydralog.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HydraLogApplication {

    public static void main(String[] args) {
        SpringApplication.run(HydraLogApplication.class, args);
    }

    /**
     * Scheduling stays off under the test profile so the offline-queue sync job
     * never drains while a test is arranging queue state.
     */
    @Configuration
    @Profile("!test")
    @EnableScheduling
    static class SchedulingEnabledConfig {
        // no-op
    }
}
