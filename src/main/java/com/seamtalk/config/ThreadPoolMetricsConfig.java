package com.seamtalk.config;

import io.micrometer.core.instrument.Gauge;
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
 * Exposes the collaborator pool via Micrometer:
 * <ul>
 *   <li>collaborator.pool.size</li>
 *   <li>collaborator.pool.active</li>
 *   <li>collaborator.pool.queued</li>
 *   <li>collaborator.pool.completed</li>
 * </ul>
 *
 * <p>Also logs a summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> collaboratorExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("collaboratorExecutor") ObjectProvider<ThreadPoolTaskExecutor> collaboratorExecutorProvider) {
        this.collaboratorExecutorProvider = collaboratorExecutorProvider;
    }

    @Bean
    public MeterBinder collaboratorExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = collaboratorExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("collaborator.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the collaborator pool")
                    .register(registry);

            Gauge.builder("collaborator.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads running collaborator calls")
                    .register(registry);

            Gauge.builder("collaborator.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of collaborator calls waiting in the queue")
                    .register(registry);

            Gauge.builder("collaborator.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed collaborator calls")
                    .register(registry);

            LOG.info("Collaborator pool metrics registered: collaborator.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = collaboratorExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Collaborator pool health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
