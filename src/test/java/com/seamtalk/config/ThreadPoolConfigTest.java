package com.seamtalk.config;

import com.seamtalk.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void defaultsSuitACoupleOfConcurrentCollaboratorCalls() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).collaboratorExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(4);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("collab-pool-");
    }

    @Test
    void appliesConfiguredSizes() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getCollaborator().setCorePoolSize(1);
        properties.getCollaborator().setMaxPoolSize(3);
        properties.getCollaborator().setThreadNamePrefix("tts-");

        executor = new ThreadPoolConfig(properties).collaboratorExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(1);
        assertThat(executor.getMaxPoolSize()).isEqualTo(3);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("tts-");
    }

    @Test
    void callerRunsWhenPoolAndQueueAreFull() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getCollaborator().setCorePoolSize(1);
        properties.getCollaborator().setMaxPoolSize(1);
        properties.getCollaborator().setQueueCapacity(1);
        executor = new ThreadPoolConfig(properties).collaboratorExecutor();

        CountDownLatch release = new CountDownLatch(1);
        Runnable blocker = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        executor.execute(blocker);
        executor.execute(blocker);

        AtomicReference<String> ranOn = new AtomicReference<>();
        executor.execute(() -> ranOn.set(Thread.currentThread().getName()));
        release.countDown();

        assertThat(ranOn.get()).isEqualTo(Thread.currentThread().getName());
    }

    @Test
    void workersSeeSubmitterContextOnly() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).collaboratorExecutor();
        AtomicReference<String> first = new AtomicReference<>();
        AtomicReference<String> second = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(2);

        ThreadContext.put("turnId", "turn-7");
        executor.execute(() -> {
            first.set(ThreadContext.get("turnId"));
            done.countDown();
        });
        ThreadContext.clearAll();
        executor.execute(() -> {
            second.set(ThreadContext.get("turnId"));
            done.countDown();
        });

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(first.get()).isEqualTo("turn-7");
        assertThat(second.get()).isNull();
    }

    @Test
    void shutdownStopsThePool() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).collaboratorExecutor();

        executor.shutdown();

        assertThat(executor.getThreadPoolExecutor().isShutdown()).isTrue();
    }
}
