package com.iplicense.search.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.iplicense.search.adapter.AdapterProperties;
import com.iplicense.search.adapter.AdapterResult;
import com.iplicense.search.adapter.EntityAdapter;
import com.iplicense.search.adapter.EntityAdapterException;
import com.iplicense.search.adapter.EntityAdapterRegistry;
import com.iplicense.search.analytics.AnalyticsEvent;
import com.iplicense.search.analytics.AnalyticsRecorder;
import com.iplicense.search.common.CallerRole;
import com.iplicense.search.common.PermissionContext;
import com.iplicense.search.config.SearchConfig;
import com.iplicense.search.config.SearchConfigService;
import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.InvalidSearchRequestException;
import com.iplicense.search.query.QueryNormalizer;
import com.iplicense.search.query.SearchFilters;
import com.iplicense.search.query.SearchQuery;
import com.iplicense.search.scoring.Candidate;
import com.iplicense.search.suggest.DidYouMean;
import com.iplicense.search.suggest.SpellingService;
import com.iplicense.search.suggest.SpellingSuggestion;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UnifiedSearchServiceTest {
    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");
    private static final PermissionContext VIEWER = new PermissionContext("u-1", "s-1", CallerRole.VIEWER, null, null);

    @Mock
    private SearchConfigService configService;

    @Mock
    private AnalyticsRecorder analyticsRecorder;

    @Mock
    private SpellingService spellingService;

    private final CountDownLatch release = new CountDownLatch(1);
    private ExecutorService executor;
    private AdapterProperties adapterProperties;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        adapterProperties = new AdapterProperties();
        adapterProperties.setDefaultTimeoutMs(1000);
        meterRegistry = new SimpleMeterRegistry();
        when(configService.current()).thenReturn(SearchConfig.builder().version(7L).build());
        lenient().when(spellingService.didYouMean(any(), anyLong(), any())).thenReturn(DidYouMean.NONE);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
        Thread.interrupted();
    }

    @Test
    void mergesScoresAndRanksAcrossAdapters() {
        when(analyticsRecorder.record(any(), anyInt(), anyLong(), any(), any())).thenReturn("evt-1");
        StubAdapter assets = new StubAdapter(EntityKind.ASSETS, 10, candidate(EntityKind.ASSETS, "a-1", "Logo"),
            candidate(EntityKind.ASSETS, "a-2", "Old logo pack"));
        UnifiedSearchService service = service(
            assets,
            new StubAdapter(EntityKind.CREATORS, 1, candidate(EntityKind.CREATORS, "c-1", "Logo Studio"))
        );

        SearchOutcome outcome = service.search(command("Logo", List.of("assets", "creators")), VIEWER);

        assertThat(outcome.isPartial()).isFalse();
        assertThat(outcome.eventId()).isEqualTo("evt-1");
        assertThat(outcome.configVersion()).isEqualTo(7L);
        assertThat(outcome.page().results()).extracting(result -> result.candidate().id())
            .containsExactly("a-1", "c-1", "a-2");
        assertThat(outcome.page().results().get(0).scores().textual()).isEqualTo(1.0);
        assertThat(outcome.page().entityCounts())
            .containsEntry(EntityKind.ASSETS, 10L)
            .containsEntry(EntityKind.CREATORS, 1L);
        verify(analyticsRecorder).record(any(SearchQuery.class), eq(3), anyLong(), eq(VIEWER),
            eq(AnalyticsEvent.Outcome.COMPLETE));
        assertThat(assets.lastTimeout).isPositive().isLessThanOrEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void timedOutAdaptersAreInterruptedAndReleaseThePool() throws InterruptedException {
        ExecutorService smallPool = Executors.newFixedThreadPool(2);
        try {
            adapterProperties.setDefaultTimeoutMs(50);
            SleepingAdapter assets = new SleepingAdapter(EntityKind.ASSETS);
            SleepingAdapter creators = new SleepingAdapter(EntityKind.CREATORS);
            UnifiedSearchService slow = service(smallPool, assets, creators);

            assertThatThrownBy(() -> slow.search(command("Logo", List.of("assets", "creators")), VIEWER))
                .isInstanceOf(SearchUnavailableException.class);

            assertThat(assets.interrupted.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(creators.interrupted.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(assets.completed.get() + creators.completed.get()).isZero();

            when(analyticsRecorder.record(any(), anyInt(), anyLong(), any(), any())).thenReturn("evt-7");
            adapterProperties.setDefaultTimeoutMs(500);
            UnifiedSearchService fast = service(
                smallPool,
                new StubAdapter(EntityKind.ASSETS, 1, candidate(EntityKind.ASSETS, "a-1", "Logo"))
            );

            SearchOutcome outcome = fast.search(command("Logo", List.of("assets")), VIEWER);

            assertThat(outcome.isPartial()).isFalse();
            assertThat(outcome.page().results()).extracting(result -> result.candidate().id()).containsExactly("a-1");
        } finally {
            smallPool.shutdownNow();
        }
    }

    @Test
    void slowAdapterTimesOutAndResponseIsPartial() {
        when(analyticsRecorder.record(any(), anyInt(), anyLong(), any(), any())).thenReturn("evt-2");
        adapterProperties.setTimeoutsMs(Map.of("creators", 50L));
        UnifiedSearchService service = service(
            new StubAdapter(EntityKind.ASSETS, 1, candidate(EntityKind.ASSETS, "a-1", "Logo")),
            new BlockingAdapter(EntityKind.CREATORS, release)
        );

        long started = System.nanoTime();
        SearchOutcome outcome = service.search(command("Logo", List.of("assets", "creators")), VIEWER);
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(outcome.isPartial()).isTrue();
        assertThat(outcome.unavailableEntities()).containsExactly(EntityKind.CREATORS);
        assertThat(outcome.page().results()).extracting(result -> result.candidate().id()).containsExactly("a-1");
        assertThat(outcome.page().entityCounts()).containsOnlyKeys(EntityKind.ASSETS);
        assertThat(tookMs).isLessThan(1000L);
        assertThat(meterRegistry.counter(
            "ss_adapter_failures_total",
            "operation",
            "search",
            "entity",
            "creators",
            "reason",
            "timeout"
        ).count())
            .isEqualTo(1.0);
        verify(analyticsRecorder).record(any(SearchQuery.class), eq(1), anyLong(), eq(VIEWER),
            eq(AnalyticsEvent.Outcome.PARTIAL));
    }

    @Test
    void failingAdapterIsIsolated() {
        when(analyticsRecorder.record(any(), anyInt(), anyLong(), any(), any())).thenReturn("evt-3");
        UnifiedSearchService service = service(
            new StubAdapter(EntityKind.ASSETS, 1, candidate(EntityKind.ASSETS, "a-1", "Logo")),
            new FailingAdapter(EntityKind.LICENSES)
        );

        SearchOutcome outcome = service.search(command("Logo", List.of("assets", "licenses")), VIEWER);

        assertThat(outcome.unavailableEntities()).containsExactly(EntityKind.LICENSES);
        assertThat(outcome.page().total()).isEqualTo(1L);
    }

    @Test
    void requestedKindWithoutAdapterIsUnavailable() {
        when(analyticsRecorder.record(any(), anyInt(), anyLong(), any(), any())).thenReturn("evt-4");
        UnifiedSearchService service = service(
            new StubAdapter(EntityKind.ASSETS, 1, candidate(EntityKind.ASSETS, "a-1", "Logo"))
        );

        SearchOutcome outcome = service.search(command("Logo", List.of("assets", "projects")), VIEWER);

        assertThat(outcome.unavailableEntities()).containsExactly(EntityKind.PROJECTS);
    }

    @Test
    void allAdaptersFailingIsAnError() {
        UnifiedSearchService service = service(
            new FailingAdapter(EntityKind.ASSETS),
            new FailingAdapter(EntityKind.CREATORS)
        );

        assertThatThrownBy(() -> service.search(command("Logo", List.of("assets", "creators")), VIEWER))
            .isInstanceOf(SearchUnavailableException.class)
            .satisfies(ex -> assertThat(((SearchUnavailableException) ex).getUnavailable())
                .containsExactly(EntityKind.ASSETS, EntityKind.CREATORS));
        verify(analyticsRecorder, never()).record(any(), anyInt(), anyLong(), any(), any());
    }

    @Test
    void invalidRequestNeverReachesAdapters() {
        StubAdapter assets = new StubAdapter(EntityKind.ASSETS, 0);
        UnifiedSearchService service = service(assets);

        assertThatThrownBy(() -> service.search(command("x", null), VIEWER))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThat(assets.calls.get()).isZero();
    }

    @Test
    void readsConfigOncePerSearch() {
        when(analyticsRecorder.record(any(), anyInt(), anyLong(), any(), any())).thenReturn("evt-5");
        UnifiedSearchService service = service(new StubAdapter(EntityKind.ASSETS, 0));

        service.search(command("Logo", List.of("assets")), VIEWER);

        verify(configService, times(1)).current();
    }

    @Test
    void interruptedSearchIsCancelledAndRecordedAsDegraded() {
        when(analyticsRecorder.record(any(), anyInt(), anyLong(), any(), any())).thenReturn("evt-6");
        BlockingAdapter blocking = new BlockingAdapter(EntityKind.ASSETS, release);
        UnifiedSearchService service = service(blocking);

        Thread.currentThread().interrupt();
        assertThatThrownBy(() -> service.search(command("Logo", List.of("assets")), VIEWER))
            .isInstanceOf(SearchCancelledException.class);

        assertThat(Thread.interrupted()).isTrue();
        verify(analyticsRecorder).record(any(SearchQuery.class), eq(0), anyLong(), eq(VIEWER),
            eq(AnalyticsEvent.Outcome.CANCELLED));
    }

    @Test
    void fewResultsCarryAnAlternativeSpelling() {
        when(analyticsRecorder.record(any(), anyInt(), anyLong(), any(), any())).thenReturn("evt-8");
        SpellingSuggestion suggestion = new SpellingSuggestion("Lgo", "logo", 0.75, 12L, 2);
        when(spellingService.didYouMean("Lgo", 1L, VIEWER))
            .thenReturn(new DidYouMean(true, suggestion, List.of()));
        UnifiedSearchService service = service(
            new StubAdapter(EntityKind.ASSETS, 1, candidate(EntityKind.ASSETS, "a-1", "Lgo"))
        );

        SearchOutcome outcome = service.search(command("Lgo", List.of("assets")), VIEWER);

        assertThat(outcome.didYouMean()).isNotNull();
        assertThat(outcome.didYouMean().suggestion().suggestedQuery()).isEqualTo("logo");
    }

    @Test
    void searchWithoutAlternativeOmitsDidYouMean() {
        when(analyticsRecorder.record(any(), anyInt(), anyLong(), any(), any())).thenReturn("evt-9");
        UnifiedSearchService service = service(
            new StubAdapter(EntityKind.ASSETS, 1, candidate(EntityKind.ASSETS, "a-1", "Logo"))
        );

        SearchOutcome outcome = service.search(command("Logo", List.of("assets")), VIEWER);

        assertThat(outcome.didYouMean()).isNull();
    }

    @Test
    void spellingFailureDoesNotFailTheSearch() {
        when(analyticsRecorder.record(any(), anyInt(), anyLong(), any(), any())).thenReturn("evt-10");
        when(spellingService.didYouMean(any(), anyLong(), any())).thenThrow(new IllegalStateException("corpus gone"));
        UnifiedSearchService service = service(new StubAdapter(EntityKind.ASSETS, 0));

        SearchOutcome outcome = service.search(command("Logo", List.of("assets")), VIEWER);

        assertThat(outcome.page().total()).isZero();
        assertThat(outcome.didYouMean()).isNull();
    }

    private UnifiedSearchService service(EntityAdapter... adapters) {
        return service(executor, adapters);
    }

    private UnifiedSearchService service(ExecutorService pool, EntityAdapter... adapters) {
        return new UnifiedSearchService(
            new QueryNormalizer(),
            configService,
            new AdapterFanOut(new EntityAdapterRegistry(List.of(adapters)), adapterProperties, pool, meterRegistry),
            new RankingAggregator(),
            analyticsRecorder,
            spellingService,
            meterRegistry,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private static SearchCommand command(String text, List<String> entities) {
        return new SearchCommand(text, entities, SearchFilters.NONE, 1, 20, null, null);
    }

    private static Candidate candidate(EntityKind kind, String id, String title) {
        Instant createdAt = id.equals("a-2") ? NOW.minusSeconds(86_400L * 400) : NOW.minusSeconds(3600);
        return new Candidate(kind, id, title, null, createdAt, createdAt, null, null, null, null);
    }

    private static final class StubAdapter implements EntityAdapter {
        private final EntityKind kind;
        private final long total;
        private final List<Candidate> candidates;
        private final AtomicInteger calls = new AtomicInteger();
        private volatile Duration lastTimeout;

        private StubAdapter(EntityKind kind, long total, Candidate... candidates) {
            this.kind = kind;
            this.total = total;
            this.candidates = new ArrayList<>(List.of(candidates));
        }

        @Override
        public EntityKind kind() {
            return kind;
        }

        @Override
        public AdapterResult search(SearchQuery query, PermissionContext permissions, int cap, Duration timeout) {
            calls.incrementAndGet();
            lastTimeout = timeout;
            return new AdapterResult(candidates, total);
        }
    }

    private static final class FailingAdapter implements EntityAdapter {
        private final EntityKind kind;

        private FailingAdapter(EntityKind kind) {
            this.kind = kind;
        }

        @Override
        public EntityKind kind() {
            return kind;
        }

        @Override
        public AdapterResult search(SearchQuery query, PermissionContext permissions, int cap, Duration timeout) {
            throw new EntityAdapterException(kind, "connection refused", null);
        }
    }

    private static final class BlockingAdapter implements EntityAdapter {
        private final EntityKind kind;
        private final CountDownLatch release;

        private BlockingAdapter(EntityKind kind, CountDownLatch release) {
            this.kind = kind;
            this.release = release;
        }

        @Override
        public EntityKind kind() {
            return kind;
        }

        @Override
        public AdapterResult search(SearchQuery query, PermissionContext permissions, int cap, Duration timeout) {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return AdapterResult.empty();
        }
    }

    private static final class SleepingAdapter implements EntityAdapter {
        private final EntityKind kind;
        private final CountDownLatch interrupted = new CountDownLatch(1);
        private final AtomicInteger completed = new AtomicInteger();

        private SleepingAdapter(EntityKind kind) {
            this.kind = kind;
        }

        @Override
        public EntityKind kind() {
            return kind;
        }

        @Override
        public AdapterResult search(SearchQuery query, PermissionContext permissions, int cap, Duration timeout) {
            try {
                Thread.sleep(1500L);
                completed.incrementAndGet();
            } catch (InterruptedException ex) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return AdapterResult.empty();
        }
    }
}
