package io.uabridge.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Scope of one connect-to-disconnect lifecycle. Every background task of a generation runs on
 * the generation's own executor, so cancelling the token interrupts and retires all of them.
 * A token is never reused: each connect attempt creates a fresh one.
 */
public final class GenerationToken {
    private static final Logger log = LoggerFactory.getLogger(GenerationToken.class);
    private static final AtomicLong SEQUENCE = new AtomicLong();
    private static final AtomicInteger LIVE_THREADS = new AtomicInteger();
    private static final int WORKER_THREADS = 4;
    private static final ThreadLocal<Long> CURRENT = new ThreadLocal<>();

    private final long id;
    private final ScheduledExecutorService executor;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch cancelledLatch = new CountDownLatch(1);
    private final AtomicInteger activeTasks = new AtomicInteger();
    private final List<Runnable> cancelCallbacks = new CopyOnWriteArrayList<>();

    private GenerationToken(long id) {
        this.id = id;
        ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(WORKER_THREADS, threadFactory(id));
        pool.setRemoveOnCancelPolicy(true);
        pool.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        pool.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        this.executor = pool;
    }

    public static GenerationToken create() {
        return new GenerationToken(SEQUENCE.incrementAndGet());
    }

    /**
     * Threads currently alive across all generations.
     */
    public static int liveThreads() {
        return LIVE_THREADS.get();
    }

    /**
     * True when the caller runs on a worker thread of any generation.
     */
    public static boolean onGenerationThread() {
        return CURRENT.get() != null;
    }

    public long id() {
        return id;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public int activeTasks() {
        return activeTasks.get();
    }

    /**
     * Runs {@code task} on this generation. Returns false when the generation is already cancelled.
     */
    public boolean execute(String name, Runnable task) {
        if (isCancelled()) {
            return false;
        }
        try {
            executor.execute(() -> runTracked(name, task));
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    public ScheduledFuture<?> scheduleAtFixedRate(String name, Runnable task, Duration period) {
        long periodMs = Math.max(1L, period.toMillis());
        return executor.scheduleAtFixedRate(() -> runTracked(name, task), periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Sleeps up to {@code delay}, returning early (false) when the generation is cancelled.
     */
    public boolean sleep(Duration delay) throws InterruptedException {
        return !cancelledLatch.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void onCancel(Runnable callback) {
        cancelCallbacks.add(callback);
        if (isCancelled()) {
            callback.run();
        }
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        cancelledLatch.countDown();
        for (Runnable callback : cancelCallbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Generation {} cancel callback failed", id, e);
            }
        }
        executor.shutdownNow();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void runTracked(String name, Runnable task) {
        if (isCancelled()) {
            return;
        }
        activeTasks.incrementAndGet();
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Background task {} failed in generation {}", name, id, e);
        } finally {
            activeTasks.decrementAndGet();
        }
    }

    private static ThreadFactory threadFactory(long generationId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(() -> {
                LIVE_THREADS.incrementAndGet();
                CURRENT.set(generationId);
                try {
                    runnable.run();
                } finally {
                    CURRENT.remove();
                    LIVE_THREADS.decrementAndGet();
                }
            }, "uabridge-gen-" + generationId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public String toString() {
        return "GenerationToken[id=" + id + ", cancelled=" + isCancelled() + "]";
    }
}
