package com.phillippitts.livescribe.config;

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
 * Exposes session executor gauges via Micrometer.
 *
 * <p>Metrics, each under {@code session.pool.*} and {@code lifecycle.pool.*}:
 * <ul>
 *   <li>size - current number of threads</li>
 *   <li>active - threads executing tasks (for the session pool: running fragment pumps)</li>
 *   <li>queued - tasks waiting in the queue</li>
 *   <li>completed - cumulative completed tasks</li>
 *   <li>max.size - configured maximum pool size</li>
 * </ul>
 *
 * <p>Available via {@code GET /actuator/metrics/session.pool.active} or Prometheus
 * {@code session_pool_active}. A health summary is also logged every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> sessionExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> lifecycleExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("sessionExecutor") ObjectProvider<ThreadPoolTaskExecutor> sessionExecutorProvider,
            @Qualifier("lifecycleExecutor") ObjectProvider<ThreadPoolTaskExecutor> lifecycleExecutorProvider) {
        this.sessionExecutorProvider = sessionExecutorProvider;
        this.lifecycleExecutorProvider = lifecycleExecutorProvider;
    }

    @Bean
    public MeterBinder sessionExecutorMetrics() {
        return registry -> {
            bind(registry, "session.pool", sessionExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "lifecycle.pool", lifecycleExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Executor metrics registered: session.pool.*, lifecycle.pool.* available via /actuator/metrics");
        };
    }

    static void bind(MeterRegistry registry, String prefix, ThreadPoolExecutor executor) {
        Gauge.builder(prefix + ".size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .register(registry);

        Gauge.builder(prefix + ".active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .register(registry);

        Gauge.builder(prefix + ".queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .register(registry);

        Gauge.builder(prefix + ".completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .register(registry);

        Gauge.builder(prefix + ".max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                .description("Configured maximum pool size")
                .register(registry);
    }

    /**
     * Logs session pool saturation every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = sessionExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Session pump pool: size={}/{}, active={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getCompletedTaskCount());
    }
}
