package com.esports.dashboard.infrastructure.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Bounds how long a caller waits for a dashboard query.
 *
 * Work runs on the dedicated query pool; the caller waits at most
 * {@code timeoutMs} and then gets a {@link QueryTimeoutException}.
 *
 * Cancellation:
 * - The abandoned future is NOT interrupted and the JDBC statement is NOT cancelled.
 *   The pool thread keeps running until the database returns (or until the
 *   JdbcTemplate statement timeout fires). Callers are released, resources are not.
 *
 * Monitoring:
 * - dashboard.query.latency{operation} timer for completed work
 * - dashboard.query.timeout{operation} counter
 * - WARN log once a query uses more than the slow-query share of its bound
 */
@Slf4j
@Component
public class QueryTimeoutGuard {

    private final Executor executor;
    private final MeterRegistry meterRegistry;
    private final double slowQueryRatio;

    public QueryTimeoutGuard(
            @Qualifier("dashboardQueryExecutor") Executor executor,
            MeterRegistry meterRegistry,
            @Value("${app.query.slow-query-ratio:0.5}") double slowQueryRatio) {
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.slowQueryRatio = slowQueryRatio;
    }

    /**
     * Run {@code work} and wait at most {@code timeoutMs} for its result.
     *
     * Runtime exceptions thrown by the work are rethrown unchanged.
     */
    public <T> T execute(String operationName, long timeoutMs, Supplier<T> work) {
        long startNanos = System.nanoTime();
        CompletableFuture<T> future = CompletableFuture.supplyAsync(work, executor);

        try {
            T result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

            Timer.builder("dashboard.query.latency")
                    .tag("operation", operationName)
                    .register(meterRegistry)
                    .record(durationMs, TimeUnit.MILLISECONDS);

            if (durationMs > timeoutMs * slowQueryRatio) {
                log.warn("Slow query detected: {} took {} ms (timeout {} ms, threshold {}%)",
                        operationName, durationMs, timeoutMs, Math.round(slowQueryRatio * 100));
            }
            return result;

        } catch (TimeoutException e) {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            log.error("Query timeout exceeded: {} after {} ms (timeout {} ms)", operationName, durationMs, timeoutMs);

            Counter.builder("dashboard.query.timeout")
                    .tag("operation", operationName)
                    .register(meterRegistry)
                    .increment();

            throw new QueryTimeoutException(operationName, timeoutMs);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Query failed: " + operationName, cause);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + operationName, e);
        }
    }
}
