package com.iplicense.search.analytics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iplicense.search.analytics.dto.RecentSearch;
import com.iplicense.search.query.EntityKind;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class AnalyticsEventRepository {
    private static final Logger logger = LoggerFactory.getLogger(AnalyticsEventRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};
    private static final String EVENT_COLUMNS =
        "id, query, entities_json, filters_json, results_count, execution_time_ms, user_id, session_id, outcome, "
            + "clicked_result_id, clicked_result_position, clicked_result_entity_kind, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public AnalyticsEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void insert(AnalyticsEvent event) {
        ClickAttachment click = event.click();
        try {
            jdbcTemplate.update(
                "INSERT INTO search_analytics_events (" + EVENT_COLUMNS + ") "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                event.id(),
                event.query(),
                toJson(event.entities().stream().map(EntityKind::value).toList()),
                toJson(event.filters()),
                event.resultsCount(),
                event.executionTimeMs(),
                event.userId(),
                event.sessionId(),
                event.outcome().name(),
                click == null ? null : click.resultId(),
                click == null ? null : click.position(),
                click == null || click.entityKind() == null ? null : click.entityKind().value(),
                Timestamp.from(event.createdAt())
            );
        } catch (DataAccessException ex) {
            throw new AnalyticsWriteException("failed to insert search event " + event.id(), ex);
        }
    }

    /**
     * @return number of rows updated; 0 when no event has this id
     */
    public int attachClick(String eventId, ClickAttachment click) {
        try {
            return jdbcTemplate.update(
                "UPDATE search_analytics_events SET clicked_result_id = ?, clicked_result_position = ?, "
                    + "clicked_result_entity_kind = ? WHERE id = ?",
                click.resultId(),
                click.position(),
                click.entityKind() == null ? null : click.entityKind().value(),
                eventId
            );
        } catch (DataAccessException ex) {
            throw new AnalyticsWriteException("failed to attach click to search event " + eventId, ex);
        }
    }

    /** Events with {@code from <= created_at < to}, newest first. */
    public List<AnalyticsEvent> findBetween(Instant from, Instant to, int limit) {
        return jdbcTemplate.query(
            "SELECT " + EVENT_COLUMNS + " FROM search_analytics_events "
                + "WHERE created_at >= ? AND created_at < ? ORDER BY created_at DESC LIMIT ?",
            (rs, rowNum) -> mapEvent(rs),
            Timestamp.from(from),
            Timestamp.from(to),
            limit
        );
    }

    public List<RecentSearch> findRecentByUser(String userId, int limit) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT query, MAX(created_at) AS last_searched_at, COUNT(*) AS search_count "
                + "FROM search_analytics_events WHERE user_id = ? "
                + "GROUP BY query ORDER BY last_searched_at DESC LIMIT ?",
            userId,
            limit
        );
        List<RecentSearch> searches = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object last = row.get("last_searched_at");
            Object count = row.get("search_count");
            searches.add(new RecentSearch(
                String.valueOf(row.get("query")),
                last instanceof Timestamp timestamp ? timestamp.toInstant() : null,
                count instanceof Number number ? number.longValue() : 0L
            ));
        }
        return searches;
    }

    private AnalyticsEvent mapEvent(ResultSet rs) throws SQLException {
        List<EntityKind> entities = new ArrayList<>();
        for (String name : fromJson(rs.getString("entities_json"), STRING_LIST, List.<String>of())) {
            EntityKind kind = EntityKind.from(name);
            if (kind != null) {
                entities.add(kind);
            }
        }
        String clickedId = rs.getString("clicked_result_id");
        ClickAttachment click = null;
        if (clickedId != null) {
            int position = rs.getInt("clicked_result_position");
            click = new ClickAttachment(clickedId, position, EntityKind.from(rs.getString("clicked_result_entity_kind")));
        }
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new AnalyticsEvent(
            rs.getString("id"),
            rs.getString("query"),
            entities,
            fromJson(rs.getString("filters_json"), OBJECT_MAP, Map.of()),
            rs.getInt("results_count"),
            rs.getLong("execution_time_ms"),
            rs.getString("user_id"),
            rs.getString("session_id"),
            parseOutcome(rs.getString("outcome")),
            click,
            createdAt == null ? null : createdAt.toInstant()
        );
    }

    private static AnalyticsEvent.Outcome parseOutcome(String raw) {
        if (raw == null) {
            return AnalyticsEvent.Outcome.COMPLETE;
        }
        try {
            return AnalyticsEvent.Outcome.valueOf(raw);
        } catch (IllegalArgumentException ex) {
            return AnalyticsEvent.Outcome.COMPLETE;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AnalyticsWriteException("failed to serialize search event field", ex);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            logger.warn("unreadable search event column: {}", ex.getOriginalMessage());
            return fallback;
        }
    }
}
