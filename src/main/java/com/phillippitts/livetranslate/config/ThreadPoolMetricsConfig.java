package com.phillippitts.livetranslate.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes translation and delivery pool metrics via Micrometer.
 *
 * <p>For each pool ({@code translation}, {@code delivery}):
 * <ul>
 *   <li>{@code <pool>.pool.size} - Current number of threads</li>
 *   <li>{@code <pool>.pool.active} - Threads actively executing tasks</li>
 *   <li>{@code <pool>.pool.queued} - Tasks waiting in the queue</li>
 *   <li>{@code <pool>.pool.completed} - Cumulative completed tasks</li>
 * </ul>
 *
 * <p>Available at {@code /actuator/metrics/translation.pool.active} and as
 * {@code translation_pool_active} on {@code /actuator/prometheus}.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> translationExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> deliveryExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("translationExecutor") ObjectProvider<ThreadPoolTaskExecutor> translationExecutorProvider,
            @Qualifier("deliveryExecutor") ObjectProvider<ThreadPoolTaskExecutor> deliveryExecutorProvider) {
        this.translationExecutorProvider = translationExecutorProvider;
        this.deliveryExecutorProvider = deliveryExecutorProvider;
    }

    @Bean
    public MeterBinder fanoutExecutorMetrics() {
        return registry -> {
            bind(registry, "translation", translationExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "delivery", deliveryExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Fan-out pool metrics registered: translation.pool.*, delivery.pool.*");
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder(pool + ".pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the " + pool + " pool")
                .register(registry);
        Gauge.builder(pool + ".pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Threads actively executing " + pool + " tasks")
                .register(registry);
        Gauge.builder(pool + ".pool.queued", executor, e -> e.getQueue().size())
                .description("Queued " + pool + " tasks")
                .register(registry);
        Gauge.builder(pool + ".pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative completed " + pool + " tasks")
                .register(registry);
    }

    /**
     * Logs pool health every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        logPool("Translation", translationExecutorProvider.getObject().getThreadPoolExecutor());
        logPool("Delivery", deliveryExecutorProvider.getObject().getThreadPoolExecutor());
    }

    private static void logPool(String name, ThreadPoolExecutor executor) {
        LOG.info("{} Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                name,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
