package com.iplicense.search.suggest;

import com.iplicense.search.common.PermissionContext;
import com.iplicense.search.config.SearchConfig;
import com.iplicense.search.config.SearchConfigService;
import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.InvalidSearchRequestException;
import com.iplicense.search.query.QueryNormalizer;
import com.iplicense.search.query.SearchQuery;
import com.iplicense.search.service.AdapterFanOut;
import com.iplicense.search.service.AdapterOutcome;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * "Did you mean" for queries that found little. Each query word is compared against the spelling corpus;
 * close words are substituted back into the query and kept only when the corrected query would find more
 * than twice as many results.
 */
@Service
public class SpellingService {
    private static final Logger log = LoggerFactory.getLogger(SpellingService.class);
    private static final double MIN_SIMILARITY = 0.7;
    private static final int MAX_ALTERNATIVES = 2;

    private final SpellingCorpus corpus;
    private final QueryNormalizer normalizer;
    private final SearchConfigService configService;
    private final AdapterFanOut fanOut;
    private final SuggestProperties properties;

    public SpellingService(
        SpellingCorpus corpus,
        QueryNormalizer normalizer,
        SearchConfigService configService,
        AdapterFanOut fanOut,
        SuggestProperties properties
    ) {
        this.corpus = corpus;
        this.normalizer = normalizer;
        this.configService = configService;
        this.fanOut = fanOut;
        this.properties = properties;
    }

    record WordMatch(String word, double similarity, int frequency) {
        double rank() {
            return similarity * 0.7 + Math.min(frequency / 100.0, 1.0) * 0.3;
        }
    }

    public DidYouMean didYouMean(String query, long currentResultCount, PermissionContext permissions) {
        SuggestProperties.Spelling spelling = properties.getSpelling();
        if (!spelling.isEnabled() || query == null || query.isBlank()
            || query.length() > configService.current().getMaxQueryLength()
            || currentResultCount > spelling.getMaxResultCount()) {
            return DidYouMean.NONE;
        }
        Map<String, Integer> frequencies = corpus.frequencies();
        if (frequencies.isEmpty()) {
            return DidYouMean.NONE;
        }

        Map<String, Double> corrections = new LinkedHashMap<>();
        for (String word : new LinkedHashSet<>(SpellingCorpus.words(query))) {
            for (WordMatch match : similarWords(word, frequencies, spelling.getCandidatesPerWord())) {
                corrections.putIfAbsent(replaceWord(query, word, match.word()), match.similarity());
            }
        }
        if (corrections.isEmpty()) {
            return DidYouMean.NONE;
        }

        long started = System.nanoTime();
        long budgetNs = spelling.getBudgetMs() * 1_000_000L;
        int estimated = 0;
        List<SpellingSuggestion> suggestions = new ArrayList<>();
        for (Map.Entry<String, Double> correction : corrections.entrySet()) {
            if (estimated >= spelling.getMaxEstimates() || System.nanoTime() - started > budgetNs) {
                log.debug("spelling estimates stopped estimated={} pending={}", estimated, corrections.size() - estimated);
                break;
            }
            estimated++;
            long expected;
            try {
                expected = estimateResultCount(correction.getKey(), permissions);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                break;
            }
            if (expected > currentResultCount * 2) {
                suggestions.add(new SpellingSuggestion(
                    query,
                    correction.getKey(),
                    correction.getValue(),
                    expected,
                    EditDistance.between(query, correction.getKey())
                ));
            }
        }
        if (suggestions.isEmpty()) {
            return DidYouMean.NONE;
        }
        suggestions.sort(Comparator.comparingDouble(SpellingService::score).reversed());
        return new DidYouMean(
            true,
            suggestions.get(0),
            suggestions.subList(1, Math.min(suggestions.size(), 1 + MAX_ALTERNATIVES))
        );
    }

    /**
     * Corpus words within a quarter of the word's length in size and more than 70% similar, best first.
     */
    static List<WordMatch> similarWords(String word, Map<String, Integer> frequencies, int limit) {
        int maxDistance = Math.max(1, word.length() / 4);
        List<WordMatch> matches = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
            String candidate = entry.getKey();
            if (Math.abs(candidate.length() - word.length()) > maxDistance || candidate.equals(word)) {
                continue;
            }
            double similarity = EditDistance.similarity(word, candidate);
            if (similarity > MIN_SIMILARITY) {
                matches.add(new WordMatch(candidate, similarity, entry.getValue()));
            }
        }
        matches.sort(
            Comparator.comparingDouble(WordMatch::rank).reversed().thenComparing(WordMatch::word)
        );
        return matches.size() > limit ? new ArrayList<>(matches.subList(0, limit)) : matches;
    }

    static String replaceWord(String query, String word, String replacement) {
        Pattern pattern = Pattern.compile("\\b" + Pattern.quote(word) + "\\b", Pattern.CASE_INSENSITIVE);
        return pattern.matcher(query).replaceAll(Matcher.quoteReplacement(replacement));
    }

    private static double score(SpellingSuggestion suggestion) {
        return suggestion.confidence() * 0.6 + (suggestion.expectedResultCount() / 100.0) * 0.4;
    }

    private long estimateResultCount(String correctedQuery, PermissionContext permissions) throws InterruptedException {
        SearchConfig config = configService.current();
        SearchQuery query;
        try {
            query = normalizer.normalize(correctedQuery, null, null, 1, null, null, null, config);
        } catch (InvalidSearchRequestException ex) {
            return 0L;
        }
        PermissionContext caller = permissions == null ? PermissionContext.ANONYMOUS : permissions;
        Map<EntityKind, AdapterOutcome<Long>> outcomes = fanOut.run(
            "spelling",
            query.getEntityKinds(),
            System.nanoTime(),
            (adapter, budget) -> adapter.count(query, caller, budget)
        );
        long total = 0L;
        for (AdapterOutcome<Long> outcome : outcomes.values()) {
            if (!outcome.isError() && outcome.getResult() != null) {
                total += outcome.getResult();
            }
        }
        return total;
    }
}
