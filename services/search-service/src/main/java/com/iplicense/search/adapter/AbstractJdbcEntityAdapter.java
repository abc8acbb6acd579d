package com.iplicense.search.adapter;

import com.iplicense.search.common.PermissionContext;
import com.iplicense.search.query.FacetField;
import com.iplicense.search.query.SearchQuery;
import com.iplicense.search.scoring.Candidate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;

/**
 * Runs a COUNT for the facet total and a capped SELECT sharing the same WHERE clause. Every statement carries
 * the caller's remaining budget as a JDBC query timeout.
 */
abstract class AbstractJdbcEntityAdapter implements EntityAdapter {
    private static final Logger log = LoggerFactory.getLogger(AbstractJdbcEntityAdapter.class);
    private static final ResultSetExtractor<Long> COUNT = rs -> rs.next() ? rs.getLong(1) : 0L;
    private static final ResultSetExtractor<List<Map<String, Object>>> ROWS =
        new RowMapperResultSetExtractor<>(new ColumnMapRowMapper());

    protected final JdbcTemplate jdbcTemplate;

    protected AbstractJdbcEntityAdapter(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public AdapterResult search(SearchQuery query, PermissionContext permissions, int cap, Duration timeout) {
        SqlCriteria criteria = criteria(query, visibility(permissions));
        String from = fromClause() + criteria.whereClause();
        try {
            long totalCount = count(from, criteria, timeout);
            if (totalCount == 0L || cap <= 0) {
                return new AdapterResult(List.of(), totalCount);
            }
            List<Candidate> candidates = select(from, criteria, cap, timeout);
            log.debug("adapter={} total={} fetched={}", kind().value(), totalCount, candidates.size());
            return new AdapterResult(candidates, totalCount);
        } catch (DataAccessException ex) {
            throw new EntityAdapterException(kind(), kind().value() + " query failed", ex);
        }
    }

    @Override
    public List<Candidate> fetch(SearchQuery query, PermissionContext permissions, int limit, Duration timeout) {
        if (limit <= 0) {
            return List.of();
        }
        SqlCriteria criteria = criteria(query, visibility(permissions));
        try {
            return select(fromClause() + criteria.whereClause(), criteria, limit, timeout);
        } catch (DataAccessException ex) {
            throw new EntityAdapterException(kind(), kind().value() + " fetch failed", ex);
        }
    }

    @Override
    public long count(SearchQuery query, PermissionContext permissions, Duration timeout) {
        SqlCriteria criteria = criteria(query, visibility(permissions));
        try {
            return count(fromClause() + criteria.whereClause(), criteria, timeout);
        } catch (DataAccessException ex) {
            throw new EntityAdapterException(kind(), kind().value() + " count failed", ex);
        }
    }

    @Override
    public Set<FacetField> facetFields() {
        return facetColumns().keySet();
    }

    @Override
    public List<FacetCount> facetCounts(
        FacetField field,
        SearchQuery query,
        PermissionContext permissions,
        Duration timeout
    ) {
        String column = facetColumns().get(field);
        if (column == null) {
            return List.of();
        }
        SqlCriteria criteria = criteria(query.withFilters(field.clear(query.getFilters())), visibility(permissions))
            .and(column + " IS NOT NULL");
        String sql = "SELECT " + column + " AS facet_value, COUNT(*) AS facet_count " + fromClause()
            + criteria.whereClause() + " GROUP BY " + column + " ORDER BY facet_count DESC, facet_value ASC";
        try {
            List<Map<String, Object>> rows = jdbcTemplate.query(
                sql,
                new TimedStatementSetter(criteria.params(), timeout),
                ROWS
            );
            List<FacetCount> counts = new ArrayList<>();
            if (rows != null) {
                for (Map<String, Object> row : rows) {
                    counts.add(new FacetCount(JdbcRows.string(row, "facet_value"), JdbcRows.longValue(row, "facet_count")));
                }
            }
            return counts;
        } catch (DataAccessException ex) {
            throw new EntityAdapterException(kind(), kind().value() + " facet query failed", ex);
        }
    }

    private long count(String from, SqlCriteria criteria, Duration timeout) {
        Long total = jdbcTemplate.query(
            "SELECT COUNT(*) " + from,
            new TimedStatementSetter(criteria.params(), timeout),
            COUNT
        );
        return total == null ? 0L : total;
    }

    private List<Candidate> select(String from, SqlCriteria criteria, int limit, Duration timeout) {
        List<Map<String, Object>> rows = jdbcTemplate.query(
            selectFields() + " " + from + " ORDER BY " + orderBy() + " LIMIT ?",
            new TimedStatementSetter(criteria.paramsWith(limit), timeout),
            ROWS
        );
        List<Candidate> candidates = new ArrayList<>(rows == null ? 0 : rows.size());
        if (rows != null) {
            for (Map<String, Object> row : rows) {
                candidates.add(toCandidate(row));
            }
        }
        return candidates;
    }

    private static PermissionContext visibility(PermissionContext permissions) {
        return permissions == null ? PermissionContext.ANONYMOUS : permissions;
    }

    /** Facetable fields and the column each one groups by. */
    protected Map<FacetField, String> facetColumns() {
        return Map.of();
    }

    protected abstract String selectFields();

    protected abstract String fromClause();

    protected abstract String orderBy();

    protected abstract SqlCriteria criteria(SearchQuery query, PermissionContext permissions);

    protected abstract Candidate toCandidate(Map<String, Object> row);
}
