package com.phillippitts.livetranslate.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the worker pools.
 *
 * <p>The translation pool runs one task per distinct target language; the delivery pool
 * runs one task per listener (including retries and synthesis). The scheduler pool backs
 * {@code @Scheduled} sweeps and delayed connection closes.
 */
@ConfigurationProperties(prefix = "threadpool")
@Validated
public class ThreadPoolProperties {

    @Valid
    private PoolProperties translation = new PoolProperties(4, 16, 100, "translate-pool-");
    @Valid
    private PoolProperties delivery = new PoolProperties(8, 32, 500, "deliver-pool-");

    /** Threads for scheduled sweeps and delayed closes. */
    @Positive(message = "Scheduler pool size must be positive")
    private int schedulerPoolSize = 2;

    public PoolProperties getTranslation() {
        return translation;
    }

    public void setTranslation(PoolProperties translation) {
        this.translation = translation;
    }

    public PoolProperties getDelivery() {
        return delivery;
    }

    public void setDelivery(PoolProperties delivery) {
        this.delivery = delivery;
    }

    public int getSchedulerPoolSize() {
        return schedulerPoolSize;
    }

    public void setSchedulerPoolSize(int schedulerPoolSize) {
        this.schedulerPoolSize = schedulerPoolSize;
    }

    /**
     * Sizing for one bounded executor.
     */
    public static class PoolProperties {
        @Positive(message = "Core pool size must be positive")
        private int corePoolSize;
        @Positive(message = "Max pool size must be positive")
        private int maxPoolSize;
        @Positive(message = "Queue capacity must be positive")
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(4, 8, 50, "pool-");
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
