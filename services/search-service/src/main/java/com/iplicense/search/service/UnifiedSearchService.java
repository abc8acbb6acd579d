package com.iplicense.search.service;

import com.iplicense.search.adapter.AdapterResult;
import com.iplicense.search.analytics.AnalyticsEvent;
import com.iplicense.search.analytics.AnalyticsRecorder;
import com.iplicense.search.common.PermissionContext;
import com.iplicense.search.config.SearchConfig;
import com.iplicense.search.config.SearchConfigService;
import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.QueryNormalizer;
import com.iplicense.search.query.SearchQuery;
import com.iplicense.search.scoring.Candidate;
import com.iplicense.search.scoring.RelevanceScorer;
import com.iplicense.search.scoring.ScoredResult;
import com.iplicense.search.suggest.DidYouMean;
import com.iplicense.search.suggest.SpellingService;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fans a query out to one adapter per requested entity kind, scores what comes back, and ranks the merged
 * set. Adapters run concurrently, each under its own deadline measured from the start of the fan-out.
 */
@Service
public class UnifiedSearchService {
    private static final Logger log = LoggerFactory.getLogger(UnifiedSearchService.class);

    private final QueryNormalizer normalizer;
    private final SearchConfigService configService;
    private final AdapterFanOut fanOut;
    private final RankingAggregator aggregator;
    private final AnalyticsRecorder analyticsRecorder;
    private final SpellingService spellingService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public UnifiedSearchService(
        QueryNormalizer normalizer,
        SearchConfigService configService,
        AdapterFanOut fanOut,
        RankingAggregator aggregator,
        AnalyticsRecorder analyticsRecorder,
        SpellingService spellingService,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        this.normalizer = normalizer;
        this.configService = configService;
        this.fanOut = fanOut;
        this.aggregator = aggregator;
        this.analyticsRecorder = analyticsRecorder;
        this.spellingService = spellingService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Normalizes and runs a search against one config snapshot.
     *
     * @throws com.iplicense.search.query.InvalidSearchRequestException when the request is malformed
     * @throws SearchUnavailableException when every requested adapter failed
     * @throws SearchCancelledException when the calling thread is interrupted while waiting on adapters
     */
    public SearchOutcome search(SearchCommand command, PermissionContext permissions) {
        long started = System.nanoTime();
        SearchConfig config = configService.current();
        SearchQuery query = normalizer.normalize(
            command.query(),
            command.entities(),
            command.filters(),
            command.page(),
            command.pageSize(),
            command.sortBy(),
            command.sortOrder(),
            config
        );
        return execute(query, config, permissions, started);
    }

    private SearchOutcome execute(SearchQuery query, SearchConfig config, PermissionContext permissions, long startedNs) {
        PermissionContext caller = permissions == null ? PermissionContext.ANONYMOUS : permissions;
        Instant referenceTime = clock.instant();

        int cap = config.getPerEntityCap();
        Map<EntityKind, AdapterOutcome<AdapterResult>> outcomes;
        try {
            outcomes = fanOut.run(
                "search",
                query.getEntityKinds(),
                startedNs,
                (adapter, budget) -> adapter.search(query, caller, cap, budget)
            );
        } catch (InterruptedException ex) {
            long tookMs = (System.nanoTime() - startedNs) / 1_000_000L;
            analyticsRecorder.record(query, 0, tookMs, caller, AnalyticsEvent.Outcome.CANCELLED);
            Thread.currentThread().interrupt();
            throw new SearchCancelledException("search cancelled while waiting for adapters", ex);
        }

        List<ScoredResult> scored = new ArrayList<>();
        Map<EntityKind, Long> totals = new EnumMap<>(EntityKind.class);
        List<EntityKind> unavailable = new ArrayList<>();
        for (Map.Entry<EntityKind, AdapterOutcome<AdapterResult>> entry : outcomes.entrySet()) {
            AdapterOutcome<AdapterResult> outcome = entry.getValue();
            if (outcome.isError()) {
                unavailable.add(entry.getKey());
                continue;
            }
            AdapterResult result = outcome.getResult();
            log.debug(
                "adapter done entity={} took_ms={} total={} fetched={}",
                outcome.getKind().value(),
                outcome.getTookMs(),
                result.totalCount(),
                result.candidates().size()
            );
            totals.put(entry.getKey(), result.totalCount());
            for (Candidate candidate : result.candidates()) {
                scored.add(RelevanceScorer.score(query, candidate, config, referenceTime));
            }
        }

        if (!outcomes.isEmpty() && unavailable.size() == outcomes.size()) {
            log.warn("all adapters unavailable query_len={} entities={}", query.getText().length(), unavailable);
            throw new SearchUnavailableException(unavailable);
        }

        RankedPage page = aggregator.aggregate(query, scored, totals);
        long tookMs = (System.nanoTime() - startedNs) / 1_000_000L;
        meterRegistry.timer("ss_search_latency", "partial", Boolean.toString(!unavailable.isEmpty()))
            .record(tookMs, TimeUnit.MILLISECONDS);

        String eventId = analyticsRecorder.record(
            query,
            (int) Math.min(Integer.MAX_VALUE, page.total()),
            tookMs,
            caller,
            unavailable.isEmpty() ? AnalyticsEvent.Outcome.COMPLETE : AnalyticsEvent.Outcome.PARTIAL
        );
        log.debug(
            "search done event_id={} total={} page={} partial={} took_ms={} config_version={}",
            eventId,
            page.total(),
            page.page(),
            !unavailable.isEmpty(),
            tookMs,
            config.getVersion()
        );
        DidYouMean didYouMean = didYouMean(query, page.total(), caller);
        return new SearchOutcome(query, page, eventId, unavailable, tookMs, config.getVersion(), didYouMean);
    }

    private DidYouMean didYouMean(SearchQuery query, long total, PermissionContext caller) {
        try {
            DidYouMean result = spellingService.didYouMean(query.getText(), total, caller);
            return result.hasAlternative() ? result : null;
        } catch (RuntimeException ex) {
            log.warn("did-you-mean lookup failed query_len={}", query.getText().length(), ex);
            return null;
        }
    }
}
