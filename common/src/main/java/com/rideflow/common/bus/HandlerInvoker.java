package com.rideflow.common.bus;

import com.rideflow.common.event.EventEnvelope;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a subscription's handler under a deadline.
 *
 * Each subscription owns one invoker, and each invoker owns one thread, so a handler
 * that overran its deadline still blocks the next delivery of the same subscription
 * instead of running next to it.
 */
public class HandlerInvoker implements AutoCloseable {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    private final EventHandler handler;
    private final Duration deadline;
    private final ExecutorService executor;

    public HandlerInvoker(String name, EventHandler handler, Duration deadline) {
        this.handler = handler;
        this.deadline = deadline;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "handler-" + name);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * @throws HandlerFailedException if the handler threw or did not finish in time
     */
    public void invoke(EventEnvelope envelope) {
        Future<?> result = executor.submit(() -> {
            MDC.put(CORRELATION_ID_MDC_KEY, envelope.getCorrelationId());
            try {
                handler.handle(envelope);
                return null;
            } finally {
                MDC.remove(CORRELATION_ID_MDC_KEY);
            }
        });

        try {
            result.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            result.cancel(true);
            throw new HandlerFailedException(String.format("Handler for %s exceeded deadline of %d ms",
                    envelope.getKind(), deadline.toMillis()), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new HandlerFailedException(String.format("Handler for %s failed: %s",
                    envelope.getKind(), cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.cancel(true);
            throw new HandlerFailedException("Interrupted while waiting for handler of " + envelope.getKind(), e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
