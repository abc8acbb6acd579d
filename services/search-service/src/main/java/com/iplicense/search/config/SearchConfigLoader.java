package com.iplicense.search.config;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads the scoring override file and applies it on top of a builder. Keys that are absent keep the
 * builder's value.
 */
@Component
public class SearchConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(SearchConfigLoader.class);

    @SuppressWarnings("unchecked")
    public SearchConfig.Builder apply(SearchConfig.Builder builder, String path) {
        if (path == null || path.isBlank()) {
            return builder;
        }
        Path resolved = resolvePath(path);
        if (!Files.exists(resolved)) {
            log.warn("search config override not found at {}", path);
            return builder;
        }

        Map<String, Object> root;
        try (InputStream input = Files.newInputStream(resolved)) {
            Object parsed = new Yaml().load(input);
            if (parsed == null) {
                return builder;
            }
            if (!(parsed instanceof Map<?, ?> map)) {
                throw new IllegalStateException("search config malformed (root not map)");
            }
            root = (Map<String, Object>) map;
        } catch (IllegalStateException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new IllegalStateException("search config load failed: " + ex.getMessage(), ex);
        }

        Map<String, Object> weights = section(root, "weights");
        if (weights != null) {
            SearchConfig.Weights current = builder.getWeights();
            builder.weights(new SearchConfig.Weights(
                asDouble(weights.get("textual"), current.textual()),
                asDouble(weights.get("recency"), current.recency()),
                asDouble(weights.get("popularity"), current.popularity()),
                asDouble(weights.get("quality"), current.quality())
            ));
        }

        Map<String, Object> recency = section(root, "recency");
        if (recency != null) {
            builder.halfLifeDays(asDouble(recency.get("half_life_days"), builder.getHalfLifeDays()));
            builder.maxAgeDays(asDouble(recency.get("max_age_days"), builder.getMaxAgeDays()));
        }

        Map<String, Object> popularity = section(root, "popularity");
        if (popularity != null) {
            SearchConfig.Popularity current = builder.getPopularity();
            builder.popularity(new SearchConfig.Popularity(
                asDouble(popularity.get("view_weight"), current.viewWeight()),
                asDouble(popularity.get("usage_weight"), current.usageWeight()),
                asDouble(popularity.get("favorite_weight"), current.favoriteWeight()),
                asLong(popularity.get("view_saturation"), current.viewSaturation()),
                asLong(popularity.get("usage_saturation"), current.usageSaturation()),
                asLong(popularity.get("favorite_saturation"), current.favoriteSaturation())
            ));
        }

        Map<String, Object> quality = section(root, "quality");
        if (quality != null) {
            SearchConfig.Quality current = builder.getQuality();
            builder.quality(new SearchConfig.Quality(
                asDouble(quality.get("base"), current.base()),
                asDouble(quality.get("verified"), current.verified()),
                asDouble(quality.get("active"), current.active()),
                asDouble(quality.get("approved"), current.approved())
            ));
        }

        Map<String, Object> parsing = section(root, "parsing");
        if (parsing != null) {
            builder.minQueryLength((int) asLong(parsing.get("min_query_length"), builder.getMinQueryLength()));
            builder.maxQueryLength((int) asLong(parsing.get("max_query_length"), builder.getMaxQueryLength()));
            Object stopWords = parsing.get("stop_words");
            if (stopWords instanceof List<?> list) {
                Set<String> words = new LinkedHashSet<>();
                for (Object item : list) {
                    if (item != null) {
                        words.add(item.toString());
                    }
                }
                builder.stopWords(words);
            }
        }

        Map<String, Object> limits = section(root, "limits");
        if (limits != null) {
            builder.perEntityCap((int) asLong(limits.get("max_results_per_entity"), builder.getPerEntityCap()));
            builder.defaultPageSize((int) asLong(limits.get("default_page_size"), builder.getDefaultPageSize()));
            builder.maxPageSize((int) asLong(limits.get("max_page_size"), builder.getMaxPageSize()));
        }
        return builder;
    }

    private Path resolvePath(String path) {
        Path direct = Path.of(path);
        if (Files.exists(direct) || direct.isAbsolute()) {
            return direct;
        }
        Path candidate = direct;
        for (int i = 0; i < 4; i++) {
            if (Files.exists(candidate)) {
                return candidate;
            }
            candidate = Path.of("..").resolve(candidate).normalize();
        }
        return direct;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> section(Map<String, Object> root, String key) {
        Object raw = root.get(key);
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new IllegalStateException("search config section '" + key + "' must be a map");
        }
        return (Map<String, Object>) map;
    }

    private double asDouble(Object raw, double fallback) {
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException("not a number: " + raw);
        }
    }

    private long asLong(Object raw, long fallback) {
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(raw.toString().trim());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException("not an integer: " + raw);
        }
    }
}
