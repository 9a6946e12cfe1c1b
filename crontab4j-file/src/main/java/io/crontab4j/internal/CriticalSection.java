package io.crontab4j.internal;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Serialises every store mutation onto a single daemon thread.
 *
 * <p>Calls made from the lock thread run inline, so nested sections cannot deadlock.
 */
public final class CriticalSection implements AutoCloseable {

    private final ExecutorService executor;
    private volatile Thread owner;

    public CriticalSection(String threadName) {
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r);
            t.setName(threadName);
            t.setDaemon(true);
            owner = t;
            return t;
        });
    }

    public boolean isLockThread() {
        return Thread.currentThread() == owner;
    }

    public <T> T call(Callable<T> task) {
        if (isLockThread()) {
            return invokeInline(task);
        }
        Future<T> future = executor.submit(task);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new IllegalStateException("interrupted while waiting for the cron lock", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    public void run(Runnable task) {
        call(() -> {
            task.run();
            return null;
        });
    }

    /**
     * Queue a task without waiting for it.
     */
    public void submit(Runnable task) {
        if (!executor.isShutdown()) {
            executor.execute(task);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static <T> T invokeInline(Callable<T> task) {
        try {
            return task.call();
        } catch (Exception e) {
            throw unwrap(e);
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        if (cause instanceof IOException io) {
            return new UncheckedIOException(io);
        }
        return new IllegalStateException(cause);
    }
}
