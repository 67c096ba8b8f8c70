package com.eainde.lending.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor that carries the caller's MDC (loanId, role) onto the worker thread.
 * Backed by a cached pool of daemon threads: agent calls block on network I/O and
 * nest (a debate task waits on its agent calls), so the pool must not be bounded.
 */
public class MdcAwareExecutor implements Executor {

    private final ExecutorService delegate;

    public MdcAwareExecutor(String threadPrefix) {
        this.delegate = Executors.newCachedThreadPool(namedDaemonThreads(threadPrefix));
    }

    @Override
    public void execute(Runnable command) {
        delegate.execute(wrap(command));
    }

    public <T> Future<T> submit(Callable<T> task) {
        // Capture MDC context from the calling (parent) thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return delegate.submit(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        });
    }

    public void shutdown() {
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(5, TimeUnit.SECONDS)) {
                delegate.shutdownNow();
            }
        } catch (InterruptedException e) {
            delegate.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Runnable wrap(Runnable command) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear(); // Clean up to avoid leaks
            }
        };
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
