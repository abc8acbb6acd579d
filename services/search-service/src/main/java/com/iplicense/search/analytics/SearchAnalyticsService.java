package com.iplicense.search.analytics;

import com.iplicense.search.analytics.dto.EntitySearchCount;
import com.iplicense.search.analytics.dto.PerformanceMetrics;
import com.iplicense.search.analytics.dto.QueryCount;
import com.iplicense.search.analytics.dto.RecentSearch;
import com.iplicense.search.analytics.dto.SearchAnalyticsSummary;
import com.iplicense.search.analytics.dto.SlowQuery;
import com.iplicense.search.analytics.dto.TrendingQuery;
import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.InvalidSearchRequestException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Admin read views computed in-process over the events of a time window.
 */
@Service
public class SearchAnalyticsService {
    static final int TOP_QUERY_LIMIT = 20;
    static final int SLOWEST_QUERY_LIMIT = 10;
    static final long TRENDING_MIN_COUNT = 3L;

    private final AnalyticsEventRepository repository;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public SearchAnalyticsService(AnalyticsEventRepository repository, AnalyticsProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public SearchAnalyticsSummary summary(Instant from, Instant to) {
        validateWindow(from, to);
        List<AnalyticsEvent> events = load(from, to);
        if (events.isEmpty()) {
            return new SearchAnalyticsSummary(from, to, 0L, 0.0, 0.0, 0.0, 0.0, List.of(), List.of(), List.of());
        }
        long total = events.size();
        long totalTime = 0L;
        long totalResults = 0L;
        long zeroResults = 0L;
        long clicked = 0L;
        Map<String, long[]> byQuery = new LinkedHashMap<>();
        Map<String, Long> byEntity = new LinkedHashMap<>();
        for (AnalyticsEvent event : events) {
            totalTime += event.executionTimeMs();
            totalResults += event.resultsCount();
            if (event.resultsCount() == 0) {
                zeroResults++;
            }
            if (event.hasClick()) {
                clicked++;
            }
            long[] stats = byQuery.computeIfAbsent(event.query(), key -> new long[2]);
            stats[0]++;
            stats[1] += event.resultsCount();
            for (EntityKind kind : event.entities()) {
                byEntity.merge(kind.value(), 1L, Long::sum);
            }
        }

        List<QueryCount> topQueries = new ArrayList<>();
        for (Map.Entry<String, long[]> entry : byQuery.entrySet()) {
            long[] stats = entry.getValue();
            topQueries.add(new QueryCount(entry.getKey(), stats[0], (double) stats[1] / stats[0]));
        }
        topQueries.sort(Comparator.comparingLong(QueryCount::count).reversed());

        List<EntitySearchCount> topEntities = new ArrayList<>();
        byEntity.forEach((entity, count) -> topEntities.add(new EntitySearchCount(entity, count)));
        topEntities.sort(Comparator.comparingLong(EntitySearchCount::searchCount).reversed());

        return new SearchAnalyticsSummary(
            from,
            to,
            total,
            (double) totalTime / total,
            (double) totalResults / total,
            (double) zeroResults / total,
            (double) clicked / total,
            limit(topQueries, TOP_QUERY_LIMIT),
            topEntities,
            zeroResultQueries(events, TOP_QUERY_LIMIT)
        );
    }

    public List<QueryCount> zeroResultQueries(Instant from, Instant to, int limit) {
        validateWindow(from, to);
        return zeroResultQueries(load(from, to), Math.max(1, limit));
    }

    public PerformanceMetrics performance(Instant from, Instant to) {
        validateWindow(from, to);
        List<AnalyticsEvent> events = new ArrayList<>(load(from, to));
        if (events.isEmpty()) {
            return PerformanceMetrics.empty();
        }
        events.sort(Comparator.comparingLong(AnalyticsEvent::executionTimeMs));
        long totalTime = 0L;
        for (AnalyticsEvent event : events) {
            totalTime += event.executionTimeMs();
        }
        List<SlowQuery> slowest = new ArrayList<>();
        for (int i = events.size() - 1; i >= 0 && slowest.size() < SLOWEST_QUERY_LIMIT; i--) {
            AnalyticsEvent event = events.get(i);
            slowest.add(new SlowQuery(event.query(), event.executionTimeMs()));
        }
        return new PerformanceMetrics(
            (double) totalTime / events.size(),
            percentile(events, 0.50),
            percentile(events, 0.95),
            percentile(events, 0.99),
            slowest
        );
    }

    /**
     * Compares the last {@code hours} against the window of equal length before it. Queries seen fewer than
     * three times in the recent window are ignored.
     */
    public List<TrendingQuery> trending(int hours, int limit) {
        if (hours < 1) {
            throw new InvalidSearchRequestException("hours must be >= 1");
        }
        Instant now = clock.instant();
        Instant recentStart = now.minus(Duration.ofHours(hours));
        Instant previousStart = recentStart.minus(Duration.ofHours(hours));

        Map<String, Long> recent = countByQuery(load(recentStart, now));
        Map<String, Long> previous = countByQuery(load(previousStart, recentStart));

        List<TrendingQuery> trending = new ArrayList<>();
        for (Map.Entry<String, Long> entry : recent.entrySet()) {
            long count = entry.getValue();
            if (count < TRENDING_MIN_COUNT) {
                continue;
            }
            long previousCount = previous.getOrDefault(entry.getKey(), 0L);
            double growth = previousCount > 0 ? (double) (count - previousCount) / previousCount * 100.0 : 100.0;
            trending.add(new TrendingQuery(entry.getKey(), count, previousCount, growth));
        }
        trending.sort(Comparator.comparingDouble(TrendingQuery::growth).reversed());
        return limit(trending, Math.max(1, limit));
    }

    public List<RecentSearch> recentSearches(String userId, int limit) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidSearchRequestException("x-user-id is required");
        }
        return repository.findRecentByUser(userId, Math.max(1, Math.min(limit, 50)));
    }

    private List<AnalyticsEvent> load(Instant from, Instant to) {
        return repository.findBetween(from, to, properties.getMaxWindowEvents());
    }

    private static List<QueryCount> zeroResultQueries(List<AnalyticsEvent> events, int limit) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (AnalyticsEvent event : events) {
            if (event.resultsCount() == 0) {
                counts.merge(event.query(), 1L, Long::sum);
            }
        }
        List<QueryCount> queries = new ArrayList<>();
        counts.forEach((query, count) -> queries.add(new QueryCount(query, count, null)));
        queries.sort(Comparator.comparingLong(QueryCount::count).reversed());
        return limit(queries, limit);
    }

    private static Map<String, Long> countByQuery(List<AnalyticsEvent> events) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (AnalyticsEvent event : events) {
            counts.merge(event.query(), 1L, Long::sum);
        }
        return counts;
    }

    // events must be sorted by execution time ascending
    static long percentile(List<AnalyticsEvent> events, double p) {
        int index = (int) Math.floor(events.size() * p);
        if (index >= events.size()) {
            return 0L;
        }
        return events.get(index).executionTimeMs();
    }

    private static void validateWindow(Instant from, Instant to) {
        if (from == null || to == null) {
            throw new InvalidSearchRequestException("from and to are required");
        }
        if (from.isAfter(to)) {
            throw new InvalidSearchRequestException("from must not be after to");
        }
    }

    private static <T> List<T> limit(List<T> items, int limit) {
        return items.size() <= limit ? items : new ArrayList<>(items.subList(0, limit));
    }
}
