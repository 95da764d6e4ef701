package io.meetflow.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the meetflow pipeline.
 *
 * @see MeetflowAutoConfiguration
 */
@ConfigurationProperties(prefix = "meetflow")
public class MeetflowProperties {

    private final Worker worker = new Worker();
    private final Retry retry = new Retry();
    private final Transcript transcript = new Transcript();
    private final Jdbc jdbc = new Jdbc();
    private final Metrics metrics = new Metrics();

    public Worker getWorker() {
        return worker;
    }

    public Retry getRetry() {
        return retry;
    }

    public Transcript getTranscript() {
        return transcript;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum RetryPolicyType {
        LINEAR,
        EXPONENTIAL
    }

    public static class Worker {
        /**
         * Whether the background worker thread is started with the application context.
         */
        private boolean enabled = true;
        private long pollIntervalMs = 5000;
        private int batchSize = 25;
        private long drainTimeoutMs = 5000;
        /**
         * Meetings with no progress for this long are failed by the stuck sweeper.
         */
        private Duration stuckTimeout = Duration.ofMinutes(15);
        private Duration generationTimeout = Duration.ofSeconds(20);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public Duration getStuckTimeout() {
            return stuckTimeout;
        }

        public void setStuckTimeout(Duration stuckTimeout) {
            this.stuckTimeout = stuckTimeout;
        }

        public Duration getGenerationTimeout() {
            return generationTimeout;
        }

        public void setGenerationTimeout(Duration generationTimeout) {
            this.generationTimeout = generationTimeout;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private RetryPolicyType policy = RetryPolicyType.LINEAR;
        private long baseDelayMs = 1000;
        /**
         * Upper bound for {@code EXPONENTIAL}; ignored by {@code LINEAR}.
         */
        private long maxDelayMs = 300_000;
        /**
         * How long a claimed failure stays invisible to other workers.
         */
        private long leaseMs = 60_000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public RetryPolicyType getPolicy() {
            return policy;
        }

        public void setPolicy(RetryPolicyType policy) {
            this.policy = policy;
        }

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

        public long getLeaseMs() {
            return leaseMs;
        }

        public void setLeaseMs(long leaseMs) {
            this.leaseMs = leaseMs;
        }
    }

    public static class Transcript {
        private Duration requestTimeout = Duration.ofSeconds(20);

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class Jdbc {
        /**
         * Prefix prepended to every table name, e.g. {@code mf_} for {@code mf_meetings}.
         */
        private String tablePrefix = "";
        /**
         * Runs the bundled DDL for the detected dialect at startup. Only valid with the
         * default table names.
         */
        private boolean initializeSchema = false;

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "meetflow";

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
