package com.iplicense.search.api;

import com.iplicense.search.analytics.SearchAnalyticsService;
import com.iplicense.search.analytics.dto.PerformanceMetrics;
import com.iplicense.search.analytics.dto.QueryCount;
import com.iplicense.search.analytics.dto.SearchAnalyticsSummary;
import com.iplicense.search.analytics.dto.TrendingQuery;
import com.iplicense.search.common.RequestContextHolder;
import com.iplicense.search.config.SearchConfig;
import com.iplicense.search.config.SearchConfigService;
import com.iplicense.search.suggest.SpellingCorpus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read views over recorded search events, config reload and spelling corpus refresh. Callers must carry the ADMIN role.
 * Windows default to the last seven days.
 */
@RestController
@RequestMapping("/admin/search")
public class SearchAdminController {
    private static final Duration DEFAULT_WINDOW = Duration.ofDays(7);

    private final SearchAnalyticsService analyticsService;
    private final SearchConfigService configService;
    private final SpellingCorpus spellingCorpus;
    private final Clock clock;

    public SearchAdminController(
        SearchAnalyticsService analyticsService,
        SearchConfigService configService,
        SpellingCorpus spellingCorpus,
        Clock clock
    ) {
        this.analyticsService = analyticsService;
        this.configService = configService;
        this.spellingCorpus = spellingCorpus;
        this.clock = clock;
    }

    @GetMapping("/analytics")
    public SearchAnalyticsSummary analytics(
        @RequestParam(value = "from", required = false) String from,
        @RequestParam(value = "to", required = false) String to
    ) {
        requireAdmin();
        Instant end = resolveTo(to);
        return analyticsService.summary(resolveFrom(from, end), end);
    }

    @GetMapping("/zero-result-queries")
    public List<QueryCount> zeroResultQueries(
        @RequestParam(value = "from", required = false) String from,
        @RequestParam(value = "to", required = false) String to,
        @RequestParam(value = "limit", defaultValue = "20") int limit
    ) {
        requireAdmin();
        Instant end = resolveTo(to);
        return analyticsService.zeroResultQueries(resolveFrom(from, end), end, limit);
    }

    @GetMapping("/performance")
    public PerformanceMetrics performance(
        @RequestParam(value = "from", required = false) String from,
        @RequestParam(value = "to", required = false) String to
    ) {
        requireAdmin();
        Instant end = resolveTo(to);
        return analyticsService.performance(resolveFrom(from, end), end);
    }

    @GetMapping("/trending")
    public List<TrendingQuery> trending(
        @RequestParam(value = "hours", defaultValue = "24") int hours,
        @RequestParam(value = "limit", defaultValue = "10") int limit
    ) {
        requireAdmin();
        return analyticsService.trending(hours, limit);
    }

    @PostMapping("/config/reload")
    public Map<String, Object> reloadConfig() {
        requireAdmin();
        SearchConfig config = configService.reload();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("version", config.getVersion());
        body.put("weights", config.getWeights());
        return body;
    }

    @PostMapping("/spelling/refresh")
    public Map<String, Object> refreshSpelling() {
        requireAdmin();
        int words = spellingCorpus.refresh();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("words", words);
        return body;
    }

    private static void requireAdmin() {
        if (!RequestContextHolder.permissions().isAdmin()) {
            throw new ForbiddenException("admin role required");
        }
    }

    private Instant resolveTo(String raw) {
        Instant parsed = SearchApiMapper.parseInstant("to", raw);
        return parsed == null ? clock.instant() : parsed;
    }

    private static Instant resolveFrom(String raw, Instant end) {
        Instant parsed = SearchApiMapper.parseInstant("from", raw);
        return parsed == null ? end.minus(DEFAULT_WINDOW) : parsed;
    }
}
