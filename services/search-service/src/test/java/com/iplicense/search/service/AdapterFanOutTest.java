package com.iplicense.search.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.iplicense.search.adapter.AdapterProperties;
import com.iplicense.search.adapter.AdapterResult;
import com.iplicense.search.adapter.EntityAdapter;
import com.iplicense.search.adapter.EntityAdapterRegistry;
import com.iplicense.search.common.PermissionContext;
import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.SearchQuery;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AdapterFanOutTest {
    private ExecutorService executor;
    private AdapterProperties adapterProperties;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        adapterProperties = new AdapterProperties();
        adapterProperties.setDefaultTimeoutMs(1000);
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        Thread.interrupted();
    }

    @Test
    void eachKindGetsItsResultAndBudget() throws InterruptedException {
        AdapterFanOut fanOut = fanOut(new NamedAdapter(EntityKind.ASSETS), new NamedAdapter(EntityKind.PROJECTS));

        Map<EntityKind, AdapterOutcome<String>> outcomes = fanOut.run(
            "suggest",
            List.of(EntityKind.ASSETS, EntityKind.PROJECTS),
            System.nanoTime(),
            (adapter, budget) -> adapter.kind().value() + ":" + (budget.compareTo(Duration.ofMillis(1000)) <= 0)
        );

        assertThat(outcomes.get(EntityKind.ASSETS).getResult()).isEqualTo("assets:true");
        assertThat(outcomes.get(EntityKind.PROJECTS).getResult()).isEqualTo("projects:true");
        assertThat(outcomes.values()).noneMatch(AdapterOutcome::isError);
    }

    @Test
    void failuresAreTaggedWithTheOperation() throws InterruptedException {
        AdapterFanOut fanOut = fanOut(new NamedAdapter(EntityKind.ASSETS));

        Map<EntityKind, AdapterOutcome<Long>> outcomes = fanOut.run(
            "facets",
            List.of(EntityKind.ASSETS, EntityKind.LICENSES),
            System.nanoTime(),
            (adapter, budget) -> {
                throw new IllegalStateException("boom");
            }
        );

        assertThat(outcomes.get(EntityKind.ASSETS).isError()).isTrue();
        assertThat(outcomes.get(EntityKind.ASSETS).getErrorMessage()).isEqualTo("boom");
        assertThat(outcomes.get(EntityKind.LICENSES).getErrorMessage()).isEqualTo("no adapter registered");
        assertThat(meterRegistry.counter(
            "ss_adapter_failures_total",
            "operation",
            "facets",
            "entity",
            "assets",
            "reason",
            "error"
        ).count()).isEqualTo(1.0);
    }

    @Test
    void expiredDeadlineSkipsTheCall() throws InterruptedException {
        adapterProperties.setDefaultTimeoutMs(10);
        CountDownLatch called = new CountDownLatch(1);
        AdapterFanOut fanOut = fanOut(new NamedAdapter(EntityKind.ASSETS));

        Map<EntityKind, AdapterOutcome<String>> outcomes = fanOut.run(
            "search",
            List.of(EntityKind.ASSETS),
            System.nanoTime() - TimeUnit.SECONDS.toNanos(1),
            (adapter, budget) -> {
                called.countDown();
                return "late";
            }
        );

        assertThat(outcomes.get(EntityKind.ASSETS).isTimedOut()).isTrue();
        assertThat(called.await(100, TimeUnit.MILLISECONDS)).isFalse();
    }

    @Test
    void interruptedCallerCancelsRunningCalls() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AdapterFanOut fanOut = fanOut(new NamedAdapter(EntityKind.ASSETS));

        Thread caller = new Thread(() -> {
            try {
                fanOut.run("search", List.of(EntityKind.ASSETS), System.nanoTime(), (adapter, budget) -> {
                    started.countDown();
                    try {
                        Thread.sleep(5000L);
                    } catch (InterruptedException ex) {
                        interrupted.countDown();
                        Thread.currentThread().interrupt();
                    }
                    return "done";
                });
            } catch (InterruptedException ex) {
                thrown.set(ex);
            }
        });
        caller.start();
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

        caller.interrupt();
        caller.join(2000L);

        assertThat(thrown.get()).isInstanceOf(InterruptedException.class);
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    private AdapterFanOut fanOut(EntityAdapter... adapters) {
        return new AdapterFanOut(new EntityAdapterRegistry(List.of(adapters)), adapterProperties, executor, meterRegistry);
    }

    private static final class NamedAdapter implements EntityAdapter {
        private final EntityKind kind;

        private NamedAdapter(EntityKind kind) {
            this.kind = kind;
        }

        @Override
        public EntityKind kind() {
            return kind;
        }

        @Override
        public AdapterResult search(SearchQuery query, PermissionContext permissions, int cap, Duration timeout) {
            return AdapterResult.empty();
        }
    }
}
