package com.iplicense.search.config;

import jakarta.annotation.PostConstruct;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holder of the active {@link SearchConfig}. Readers take one snapshot per query; reloads swap the whole
 * instance so a request never sees a mix of old and new values.
 */
@Component
public class SearchConfigService {
    private static final Logger log = LoggerFactory.getLogger(SearchConfigService.class);

    private final SearchConfigLoader loader;
    private final ScoringProperties properties;
    private final AtomicReference<SearchConfig> current = new AtomicReference<>();

    public SearchConfigService(SearchConfigLoader loader, ScoringProperties properties) {
        this.loader = loader;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        try {
            SearchConfig loaded = build(1L);
            current.set(loaded);
            logLoaded("search config loaded", loaded);
        } catch (IllegalStateException ex) {
            if (properties.isStrict()) {
                throw ex;
            }
            log.warn("search config override rejected, using property defaults: {}", ex.getMessage());
            current.set(properties.toBuilder().version(1L).build());
        }
    }

    public SearchConfig current() {
        SearchConfig config = current.get();
        if (config == null) {
            init();
            config = current.get();
        }
        return config;
    }

    /**
     * Re-reads property defaults and the override file and swaps the result in.
     *
     * @throws InvalidSearchConfigException when the new values do not validate; the active config is kept
     */
    public SearchConfig reload() {
        SearchConfig candidate;
        try {
            candidate = build(0L);
        } catch (IllegalStateException ex) {
            log.warn("search config reload rejected version={} reason={}", current().getVersion(), ex.getMessage());
            throw new InvalidSearchConfigException(ex.getMessage(), ex);
        }
        SearchConfig next = current.updateAndGet(
            previous -> candidate.toBuilder().version(previous == null ? 1L : previous.getVersion() + 1).build()
        );
        logLoaded("search config reloaded", next);
        return next;
    }

    private SearchConfig build(long version) {
        SearchConfig.Builder builder = properties.toBuilder();
        loader.apply(builder, properties.getConfigPath());
        return builder.version(version).build();
    }

    private void logLoaded(String message, SearchConfig config) {
        SearchConfig.Weights weights = config.getWeights();
        log.info(
            "{} version={} weights=[textual={} recency={} popularity={} quality={}] half_life_days={} max_age_days={}",
            message,
            config.getVersion(),
            weights.textual(),
            weights.recency(),
            weights.popularity(),
            weights.quality(),
            config.getHalfLifeDays(),
            config.getMaxAgeDays()
        );
    }
}
