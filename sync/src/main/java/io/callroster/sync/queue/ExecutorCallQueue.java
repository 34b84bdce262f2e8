// file: src/main/java/io/callroster/sync/queue/ExecutorCallQueue.java
package io.callroster.sync.queue;

import io.callroster.core.Cancellable;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link CallQueue} backed by a single-threaded scheduler.
 * <p>
 * One daemon thread per call. A task that throws is logged and does not kill
 * the thread, so one bad update cannot stall the call.
 */
public final class ExecutorCallQueue implements CallQueue {
    private static final Logger log = Logger.getLogger(ExecutorCallQueue.class.getName());

    private final String name;
    private final ScheduledExecutorService exec;

    public ExecutorCallQueue(String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.exec = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "call-queue-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        try {
            exec.execute(() -> runSafe(task));
        } catch (RejectedExecutionException e) {
            log.log(Level.FINE, "[" + name + "] task dropped after shutdown");
        }
    }

    @Override
    public Cancellable scheduleAtFixedRate(Runnable task, Duration period) {
        Objects.requireNonNull(task, "task");
        long millis = Objects.requireNonNull(period, "period").toMillis();
        if (millis <= 0) {
            throw new IllegalArgumentException("period must be positive, got: " + period);
        }
        ScheduledFuture<?> f = exec.scheduleAtFixedRate(() -> runSafe(task), millis, millis, TimeUnit.MILLISECONDS);
        return () -> f.cancel(false);
    }

    @Override
    public void shutdown() {
        exec.shutdownNow();
    }

    private void runSafe(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "[" + name + "] task failed", e);
        }
    }
}
