package io.recordqueue.spring.boot;

import io.recordqueue.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the record queue.
 *
 * @see RecordQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "recordqueue")
public class RecordQueueProperties {

    /**
     * Whether the queue starts with the application context.
     */
    private boolean autoStartup = true;

    /**
     * Database table holding records.
     */
    private String tableName = TableNames.DEFAULT_RECORD_TABLE;

    /**
     * Minimum interval between two edits of the same record.
     */
    private Duration editCooldown = Duration.ofDays(7);

    /**
     * Maximum number of job states kept for status lookups; 0 disables tracking.
     */
    private int statusRetention = 10_000;

    /**
     * How long context shutdown waits for in-flight jobs.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    private final Worker worker = new Worker();
    private final Retry retry = new Retry();
    private final DeadLetter deadLetter = new DeadLetter();
    private final Metrics metrics = new Metrics();

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public Duration getEditCooldown() {
        return editCooldown;
    }

    public void setEditCooldown(Duration editCooldown) {
        this.editCooldown = editCooldown;
    }

    public int getStatusRetention() {
        return statusRetention;
    }

    public void setStatusRetention(int statusRetention) {
        this.statusRetention = statusRetention;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Worker getWorker() {
        return worker;
    }

    public Retry getRetry() {
        return retry;
    }

    public DeadLetter getDeadLetter() {
        return deadLetter;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Worker {
        private int count = 5;
        private Duration idleInterval = Duration.ofMillis(100);
        private Duration errorBackoff = Duration.ofSeconds(1);
        private int maxAttempts = 1;
        private Duration storeCallTimeout;
        private Duration agingThreshold;

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = count;
        }

        public Duration getIdleInterval() {
            return idleInterval;
        }

        public void setIdleInterval(Duration idleInterval) {
            this.idleInterval = idleInterval;
        }

        public Duration getErrorBackoff() {
            return errorBackoff;
        }

        public void setErrorBackoff(Duration errorBackoff) {
            this.errorBackoff = errorBackoff;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getStoreCallTimeout() {
            return storeCallTimeout;
        }

        public void setStoreCallTimeout(Duration storeCallTimeout) {
            this.storeCallTimeout = storeCallTimeout;
        }

        public Duration getAgingThreshold() {
            return agingThreshold;
        }

        public void setAgingThreshold(Duration agingThreshold) {
            this.agingThreshold = agingThreshold;
        }
    }

    public static class Retry {
        private long baseDelayMs = 200;
        private long maxDelayMs = 60000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class DeadLetter {
        private boolean enabled = false;
        private String tableName = TableNames.DEFAULT_DEAD_JOB_TABLE;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "recordqueue";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
