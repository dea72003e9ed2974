package com.seamtalk.util.concurrent;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link SerialExecutor} backed by one daemon thread.
 *
 * <p>Every task runs with the executor's Log4j2 {@link ThreadContext} entries (e.g.
 * {@code connectionId}) so log lines of one connection can be correlated. Task failures are
 * logged and do not kill the thread.
 */
public final class SingleThreadSerialExecutor implements SerialExecutor {

    private static final Logger LOG = LogManager.getLogger(SingleThreadSerialExecutor.class);

    private final String name;
    private final Map<String, String> logContext;
    private final ScheduledExecutorService delegate;

    public SingleThreadSerialExecutor(String name) {
        this(name, Map.of());
    }

    public SingleThreadSerialExecutor(String name, Map<String, String> logContext) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.logContext = Map.copyOf(logContext);
        this.delegate = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        try {
            delegate.execute(decorate(task));
        } catch (RejectedExecutionException e) {
            LOG.debug("Executor {} is shut down; dropping task", name);
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        Objects.requireNonNull(task, "task must not be null");
        try {
            ScheduledFuture<?> future = delegate.schedule(decorate(task), delay.toNanos(), TimeUnit.NANOSECONDS);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException e) {
            LOG.debug("Executor {} is shut down; dropping scheduled task", name);
            return () -> false;
        }
    }

    @Override
    public void shutdown() {
        delegate.shutdown();
    }

    /** @return true once {@link #shutdown()} was called */
    public boolean isShutdown() {
        return delegate.isShutdown();
    }

    private Runnable decorate(Runnable task) {
        return () -> {
            try {
                if (!logContext.isEmpty()) {
                    ThreadContext.putAll(logContext);
                }
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Task failed on executor {}", name, e);
            } finally {
                ThreadContext.clearAll();
            }
        };
    }
}
