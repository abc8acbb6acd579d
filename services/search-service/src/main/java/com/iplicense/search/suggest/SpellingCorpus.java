package com.iplicense.search.suggest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Word frequencies drawn from entity text and recent successful queries. Rebuilt lazily once the refresh
 * interval has passed; a failed rebuild keeps serving the previous words.
 */
@Component
public class SpellingCorpus {
    private static final Logger log = LoggerFactory.getLogger(SpellingCorpus.class);
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int QUERY_WEIGHT = 2;

    private final SpellingCorpusRepository repository;
    private final SuggestProperties properties;
    private final Clock clock;

    private volatile Map<String, Integer> frequencies = Map.of();
    private volatile Instant lastAttempt;

    public SpellingCorpus(SpellingCorpusRepository repository, SuggestProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    /** Lowercase words longer than two characters; punctuation splits words. */
    public static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return words;
        }
        String cleaned = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        for (String part : WHITESPACE.split(cleaned)) {
            if (part.length() > 2) {
                words.add(part);
            }
        }
        return words;
    }

    public Map<String, Integer> frequencies() {
        Instant attempted = lastAttempt;
        Duration interval = Duration.ofMinutes(properties.getSpelling().getRefreshMinutes());
        if (attempted == null || !clock.instant().isBefore(attempted.plus(interval))) {
            refreshIfStale(interval);
        }
        return frequencies;
    }

    /** Rebuilds now regardless of age. */
    public synchronized int refresh() {
        lastAttempt = clock.instant();
        SuggestProperties.Spelling spelling = properties.getSpelling();
        Map<String, Integer> next = new HashMap<>();
        addAll(next, repository.assetTexts(spelling.getAssetSample()), 1);
        addAll(next, repository.creatorTexts(spelling.getCreatorSample()), 1);
        addAll(next, repository.projectTexts(spelling.getProjectSample()), 1);
        Instant since = clock.instant().minus(Duration.ofDays(spelling.getQueryLookbackDays()));
        addAll(next, repository.successfulQueries(since, spelling.getQuerySample()), QUERY_WEIGHT);
        frequencies = Collections.unmodifiableMap(next);
        log.info("spelling corpus rebuilt words={}", next.size());
        return next.size();
    }

    private synchronized void refreshIfStale(Duration interval) {
        Instant attempted = lastAttempt;
        if (attempted != null && clock.instant().isBefore(attempted.plus(interval))) {
            return;
        }
        try {
            refresh();
        } catch (DataAccessException ex) {
            log.warn("spelling corpus rebuild failed; keeping {} words", frequencies.size(), ex);
        }
    }

    private static void addAll(Map<String, Integer> target, List<String> texts, int weight) {
        for (String text : texts) {
            for (String word : words(text)) {
                target.merge(word, weight, Integer::sum);
            }
        }
    }
}
