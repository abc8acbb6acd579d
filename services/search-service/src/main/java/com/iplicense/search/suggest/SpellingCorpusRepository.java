package com.iplicense.search.suggest;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Samples of searchable text the spelling corpus is built from. Each row is a title and a description joined
 * by a space.
 */
@Repository
public class SpellingCorpusRepository {
    private static final RowMapper<String> TEXT = (rs, rowNum) -> join(rs.getString(1), rs.getString(2));

    private final JdbcTemplate jdbcTemplate;

    public SpellingCorpusRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<String> assetTexts(int limit) {
        return jdbcTemplate.query(
            "SELECT title, description FROM ip_assets WHERE deleted_at IS NULL ORDER BY created_at DESC LIMIT ?",
            TEXT,
            limit
        );
    }

    public List<String> creatorTexts(int limit) {
        return jdbcTemplate.query(
            "SELECT stage_name, bio FROM creators WHERE deleted_at IS NULL ORDER BY created_at DESC LIMIT ?",
            TEXT,
            limit
        );
    }

    public List<String> projectTexts(int limit) {
        return jdbcTemplate.query(
            "SELECT name, description FROM projects WHERE deleted_at IS NULL ORDER BY created_at DESC LIMIT ?",
            TEXT,
            limit
        );
    }

    /** Distinct query strings that returned at least one result since {@code since}. */
    public List<String> successfulQueries(Instant since, int limit) {
        return jdbcTemplate.query(
            "SELECT DISTINCT query FROM search_analytics_events WHERE results_count > 0 AND created_at >= ? LIMIT ?",
            (rs, rowNum) -> rs.getString(1),
            Timestamp.from(since),
            limit
        );
    }

    private static String join(String first, String second) {
        if (second == null || second.isBlank()) {
            return first == null ? "" : first;
        }
        return first == null ? second : first + " " + second;
    }
}
