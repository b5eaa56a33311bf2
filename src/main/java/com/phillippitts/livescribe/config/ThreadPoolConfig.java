package com.phillippitts.livescribe.config;

import com.phillippitts.livescribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for session work.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned in
 * application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs one fragment pump per live session.
     *
     * <p>Pool sizing configured via {@code threadpool.session.*}:
     * <ul>
     *   <li>Core pool: default 4</li>
     *   <li>Max pool: default 200, the ceiling on concurrent sessions</li>
     *   <li>Queue: default 0 - direct hand-off, a pump never waits behind another</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A rejected pump fails the
     * {@code start} that submitted it; running it on the caller thread would block the
     * connection for the whole session.
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext (sessionId, connectionId) from the
     * submitting thread to the worker thread.
     *
     * @return executor for fragment pumps
     */
    @Bean(name = "sessionExecutor")
    public ThreadPoolTaskExecutor sessionExecutor() {
        ThreadPoolProperties.SessionPoolProperties props = threadPoolProperties.getSession();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Runs parallel session teardown during shutdown.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}; when the pool is saturated
     * the shutdown thread stops the session itself.
     *
     * @return executor for session teardown
     */
    @Bean(name = "lifecycleExecutor")
    public ThreadPoolTaskExecutor lifecycleExecutor() {
        ThreadPoolProperties.LifecyclePoolProperties props = threadPoolProperties.getLifecycle();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitter's ThreadContext onto the worker for the duration of the task and
     * restores the worker's own context afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
