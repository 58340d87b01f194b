package com.example.taskhub.scheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Scheduler settings, bound from {@code scheduler.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "scheduler")
@Data
public class SchedulerProperties {

    private TickConfig tick = new TickConfig();
    private DispatcherConfig dispatcher = new DispatcherConfig();
    private RetryConfig retry = new RetryConfig();

    /**
     * Timeout for task bodies that do not declare their own.
     */
    private long defaultTimeoutMs = 300_000L;

    /**
     * Zone cron expressions are evaluated in. Empty means the system zone.
     */
    private String zone = "";

    @Data
    public static class TickConfig {
        private long delayMs = 10_000L;
        private long initialDelayMs = 5_000L;
        /**
         * Upper bound of due jobs read per tick.
         */
        private int batchSize = 500;
    }

    @Data
    public static class DispatcherConfig {
        /**
         * Number of worker slots; at most this many task bodies run at once on this node.
         */
        private int workers = 8;
        private long pollDelayMs = 1_000L;
        private int batch = 16;
        /**
         * A claimed request whose heartbeat is older than this is handed to another worker.
         */
        private long leaseMs = 600_000L;
        private long sweepDelayMs = 15_000L;
        /**
         * Delay before a QUEUE request blocked by a running sibling is looked at again.
         */
        private long queueRecheckMs = 1_000L;
        /**
         * Identity written into claimed requests and running logs. Empty means host:pid.
         */
        private String ownerId = "";
    }

    @Data
    public static class RetryConfig {
        private long baseDelayMs = 2_000L;
        private long maxDelayMs = 300_000L;
        private int maxAttempts = 3;
    }
}
