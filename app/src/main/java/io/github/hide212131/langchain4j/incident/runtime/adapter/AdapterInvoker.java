package io.github.hide212131.langchain4j.incident.runtime.adapter;

import io.github.hide212131.langchain4j.incident.infra.logging.WorkflowLogger;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs adapter calls on a bounded worker pool shared by all sessions of one engine.
 *
 * <p>At most {@code concurrency} calls are in flight; a caller that cannot obtain a slot within
 * the call timeout gets a {@link FailureKind#REJECTED} failure instead of queueing without
 * bound. Waiting for a slot counts against the same timeout as the call itself.</p>
 */
public final class AdapterInvoker implements AutoCloseable {

    private final Duration timeout;
    private final Semaphore permits;
    private final ExecutorService executor;
    private final WorkflowLogger logger;

    public AdapterInvoker(Duration timeout, int concurrency, WorkflowLogger logger) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
        this.permits = new Semaphore(concurrency, true);
        this.executor = Executors.newFixedThreadPool(concurrency, new AdapterThreadFactory());
        this.logger = Objects.requireNonNull(logger, "logger").forComponent(AdapterInvoker.class);
    }

    /**
     * Calls the adapter and waits for its answer.
     *
     * @throws AdapterFailure when the call times out, is rejected, is interrupted or fails
     */
    public <T> T invoke(String adapter, AdapterCall<T> call) {
        Objects.requireNonNull(adapter, "adapter");
        Objects.requireNonNull(call, "call");
        long timeoutMillis = timeout.toMillis();
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            if (!permits.tryAcquire(timeoutMillis, TimeUnit.MILLISECONDS)) {
                logger.warn("Adapter {} rejected: no worker available within {} ms", adapter, timeoutMillis);
                throw new AdapterFailure(adapter, FailureKind.REJECTED,
                        "no worker available within " + timeoutMillis + " ms", null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdapterFailure(adapter, FailureKind.INTERRUPTED, "interrupted while waiting for a worker", e);
        }

        try {
            Callable<T> task = call::call;
            Future<T> future = executor.submit(task);
            return await(adapter, future, deadline, timeoutMillis);
        } finally {
            permits.release();
        }
    }

    // the wait for a worker and the wait for the result share one deadline
    private <T> T await(String adapter, Future<T> future, long deadline, long timeoutMillis) {
        try {
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Adapter {} timed out after {} ms", adapter, timeoutMillis);
            throw new AdapterFailure(adapter, FailureKind.TIMEOUT, "timed out after " + timeoutMillis + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("Adapter {} failed: {}", adapter, cause.getMessage());
            throw new AdapterFailure(adapter, FailureKind.FAILED, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AdapterFailure(adapter, FailureKind.INTERRUPTED, "interrupted while waiting for result", e);
        }
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static final class AdapterThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "incident-adapter-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
