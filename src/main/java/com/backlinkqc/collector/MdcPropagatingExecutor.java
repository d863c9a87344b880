package com.backlinkqc.collector;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs collector calls on a bounded pool while keeping the caller's MDC
 * (notably {@code orderId}) on the worker thread. Cancelling a returned
 * future interrupts the worker.
 */
public class MdcPropagatingExecutor implements AutoCloseable {

    private final ExecutorService delegate;

    public MdcPropagatingExecutor(ExecutorService delegate) {
        this.delegate = delegate;
    }

    public <T> Future<T> submit(Callable<T> task) {
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

    @Override
    public void close() {
        delegate.shutdown();
    }
}
