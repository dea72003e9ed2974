package com.seamtalk.util.concurrent;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Single-consumer task queue: tasks run one at a time, in submission order, never concurrently.
 *
 * <p>Used as an actor mailbox. State that is only touched from tasks of one executor needs no
 * locking. Both the client session and every relay connection own one.
 */
public interface SerialExecutor extends Executor {

    /**
     * Queues a task. After {@link #shutdown()} tasks are discarded (logged at debug level),
     * so late callbacks from sockets never throw into foreign threads.
     */
    @Override
    void execute(Runnable task);

    /**
     * Runs {@code task} on this executor after {@code delay}.
     *
     * @return handle to cancel the task before it runs
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /** Lets already-queued tasks finish and rejects new ones. Idempotent. */
    void shutdown();

    /** Handle to a delayed task. */
    interface ScheduledTask {
        /**
         * Cancels the task if it has not started yet.
         *
         * @return {@code true} if this call prevented the task from running
         */
        boolean cancel();
    }
}
