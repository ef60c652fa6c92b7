package com.aegis.common.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Thread-safe utilities for concurrent operations
 * Provides safe patterns for common concurrency scenarios
 */
@Slf4j
public final class ConcurrencyUtils {

    private ConcurrencyUtils() {
    }

    /**
     * Executes an action with a lock
     */
    public static <T> T withLock(Lock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Executes an action with a lock (void return)
     */
    public static void withLockVoid(Lock lock, Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs every task and waits until all have completed or the timeout elapses.
     * Tasks still running at the deadline are cancelled with interruption before
     * this method returns, so none of them outlives the call.
     *
     * <p>If the executor rejects a task, tasks already submitted are cancelled
     * and the {@link java.util.concurrent.RejectedExecutionException} is rethrown.
     *
     * <p>Futures are returned in task order. Callers inspect each one with
     * {@link Future#isCancelled()} before calling {@link Future#get()}.
     */
    public static <T> List<Future<T>> invokeAllWithin(
            List<? extends Callable<T>> tasks,
            ExecutorService executor,
            Duration timeout) throws InterruptedException {

        return executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Bounded executor that runs tasks on the caller when the queue is full
     */
    public static ExecutorService createBoundedExecutor(
            int corePoolSize,
            int maxPoolSize,
            int queueCapacity,
            String threadNamePrefix) {

        return createBoundedExecutor(corePoolSize, maxPoolSize, queueCapacity, threadNamePrefix,
            new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Bounded executor with an explicit saturation policy. Callers that hold a
     * deadline pass {@link ThreadPoolExecutor.AbortPolicy} so a full pool
     * surfaces as {@link java.util.concurrent.RejectedExecutionException}
     * instead of running the task on the calling thread.
     */
    public static ExecutorService createBoundedExecutor(
            int corePoolSize,
            int maxPoolSize,
            int queueCapacity,
            String threadNamePrefix,
            RejectedExecutionHandler rejectionHandler) {

        return new ThreadPoolExecutor(
            corePoolSize,
            maxPoolSize,
            60L, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(queueCapacity),
            new ThreadFactory() {
                private final AtomicInteger counter = new AtomicInteger(0);

                @Override
                public Thread newThread(Runnable r) {
                    Thread t = new Thread(r, threadNamePrefix + "-" + counter.incrementAndGet());
                    t.setDaemon(false);
                    return t;
                }
            },
            rejectionHandler
        );
    }

    /**
     * Safely shuts down multiple executors
     */
    public static void shutdownExecutors(Duration timeout, ExecutorService... executors) {
        for (ExecutorService executor : executors) {
            if (executor != null) {
                executor.shutdown();
            }
        }

        for (ExecutorService executor : executors) {
            if (executor != null) {
                try {
                    if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                        log.warn("Executor did not terminate within {} ms, forcing shutdown", timeout.toMillis());
                        executor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    executor.shutdownNow();
                }
            }
        }
    }
}
