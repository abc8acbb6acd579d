package com.iplicense.search.service;

import com.iplicense.search.adapter.AdapterProperties;
import com.iplicense.search.adapter.EntityAdapter;
import com.iplicense.search.adapter.EntityAdapterRegistry;
import com.iplicense.search.query.EntityKind;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs one call per entity kind on the search executor. Each kind gets its own deadline measured from the
 * caller's start time; a call that misses it is cancelled with an interrupt so its worker is released.
 */
@Component
public class AdapterFanOut {
    private static final Logger log = LoggerFactory.getLogger(AdapterFanOut.class);

    private final EntityAdapterRegistry adapterRegistry;
    private final AdapterProperties adapterProperties;
    private final ExecutorService searchExecutor;
    private final MeterRegistry meterRegistry;

    public AdapterFanOut(
        EntityAdapterRegistry adapterRegistry,
        AdapterProperties adapterProperties,
        @Qualifier("searchExecutor") ExecutorService searchExecutor,
        MeterRegistry meterRegistry
    ) {
        this.adapterRegistry = adapterRegistry;
        this.adapterProperties = adapterProperties;
        this.searchExecutor = searchExecutor;
        this.meterRegistry = meterRegistry;
    }

    /** One adapter call, handed the budget left before its deadline. */
    @FunctionalInterface
    public interface AdapterCall<T> {
        T call(EntityAdapter adapter, Duration budget);
    }

    /**
     * Dispatches {@code call} for every kind and waits for all of them. Failed and late kinds come back as
     * error outcomes and are counted under {@code operation}.
     *
     * @throws InterruptedException when the caller is interrupted; every pending call is cancelled first
     */
    public <T> Map<EntityKind, AdapterOutcome<T>> run(
        String operation,
        Collection<EntityKind> kinds,
        long startedNs,
        AdapterCall<T> call
    ) throws InterruptedException {
        Map<EntityKind, Future<AdapterOutcome<T>>> futures = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : kinds) {
            futures.put(kind, dispatch(kind, deadline(kind, startedNs), call));
        }

        Map<EntityKind, AdapterOutcome<T>> outcomes = new EnumMap<>(EntityKind.class);
        for (Map.Entry<EntityKind, Future<AdapterOutcome<T>>> entry : futures.entrySet()) {
            EntityKind kind = entry.getKey();
            try {
                outcomes.put(kind, await(kind, entry.getValue(), deadline(kind, startedNs)));
            } catch (InterruptedException ex) {
                futures.values().forEach(future -> future.cancel(true));
                throw ex;
            }
        }
        for (AdapterOutcome<T> outcome : outcomes.values()) {
            if (outcome.isError()) {
                meterRegistry.counter(
                    "ss_adapter_failures_total",
                    "operation",
                    operation,
                    "entity",
                    outcome.getKind().value(),
                    "reason",
                    outcome.isTimedOut() ? "timeout" : "error"
                ).increment();
                log.warn(
                    "adapter unavailable operation={} entity={} timed_out={} reason={}",
                    operation,
                    outcome.getKind().value(),
                    outcome.isTimedOut(),
                    outcome.getErrorMessage()
                );
            }
        }
        return outcomes;
    }

    private long deadline(EntityKind kind, long startedNs) {
        return startedNs + adapterProperties.timeoutFor(kind).toNanos();
    }

    // the task re-checks the deadline once it leaves the queue so a saturated pool turns into timeouts
    private <T> Future<AdapterOutcome<T>> dispatch(EntityKind kind, long deadlineNs, AdapterCall<T> call) {
        Optional<EntityAdapter> adapter = adapterRegistry.find(kind);
        if (adapter.isEmpty()) {
            return CompletableFuture.completedFuture(AdapterOutcome.error(kind, "no adapter registered"));
        }
        EntityAdapter target = adapter.get();
        try {
            return searchExecutor.submit(() -> {
                long started = System.nanoTime();
                long remainingNs = deadlineNs - started;
                if (remainingNs <= 0L) {
                    return AdapterOutcome.<T>timedOut(kind);
                }
                T result = call.call(target, Duration.ofNanos(remainingNs));
                return AdapterOutcome.success(kind, result, (System.nanoTime() - started) / 1_000_000L);
            });
        } catch (RejectedExecutionException ex) {
            return CompletableFuture.completedFuture(AdapterOutcome.error(kind, "search executor rejected task"));
        }
    }

    private <T> AdapterOutcome<T> await(EntityKind kind, Future<AdapterOutcome<T>> future, long deadlineNs)
        throws InterruptedException {
        try {
            long remainingNs = deadlineNs - System.nanoTime();
            if (remainingNs <= 0L && !future.isDone()) {
                future.cancel(true);
                return AdapterOutcome.timedOut(kind);
            }
            return future.get(Math.max(0L, remainingNs), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return AdapterOutcome.timedOut(kind);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            return AdapterOutcome.error(kind, cause == null ? e.getMessage() : cause.getMessage());
        } catch (CancellationException e) {
            return AdapterOutcome.error(kind, "cancelled");
        }
    }
}
