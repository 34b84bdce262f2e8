// file: src/main/java/io/callroster/sync/queue/CallQueue.java
package io.callroster.sync.queue;

import io.callroster.core.Cancellable;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * The serialization point of one call.
 * <p>
 * Every read-modify-write of roster state runs as a task on this queue, one at a
 * time, in submission order. Network completions are re-delivered here (it is an
 * {@link Executor}, so {@code future.whenCompleteAsync(fn, queue)} works) before
 * they touch state, which is why the engine itself needs no locks.
 */
public interface CallQueue extends Executor {

    /** Run {@code task} on the queue after all previously submitted tasks. */
    @Override
    void execute(Runnable task);

    /**
     * Run {@code task} on the queue every {@code period}, first run one period from now.
     *
     * @return handle that stops further runs
     */
    Cancellable scheduleAtFixedRate(Runnable task, Duration period);

    /** Stop accepting work. Tasks already running finish; queued ones may be dropped. */
    void shutdown();
}
