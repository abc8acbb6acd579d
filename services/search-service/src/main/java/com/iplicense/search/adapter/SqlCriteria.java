package com.iplicense.search.adapter;

import com.iplicense.search.query.SearchQuery;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Accumulates an AND-joined WHERE clause with positional parameters. Text patterns are lowercased and their
 * LIKE wildcards escaped with a backslash.
 */
final class SqlCriteria {
    static final String ESCAPE = " ESCAPE '\\'";

    private final List<String> clauses = new ArrayList<>();
    private final List<Object> params = new ArrayList<>();

    SqlCriteria and(String clause, Object... values) {
        clauses.add(clause);
        for (Object value : values) {
            params.add(value);
        }
        return this;
    }

    SqlCriteria andIn(String column, List<String> values) {
        if (values == null || values.isEmpty()) {
            return this;
        }
        clauses.add(column + " IN (" + placeholders(values.size()) + ")");
        params.addAll(values);
        return this;
    }

    SqlCriteria andEquals(String column, String value) {
        if (value == null || value.isBlank()) {
            return this;
        }
        return and(column + " = ?", value);
    }

    SqlCriteria andCreatedBetween(String column, Instant from, Instant to) {
        if (from != null) {
            and(column + " >= ?", Timestamp.from(from));
        }
        if (to != null) {
            and(column + " <= ?", Timestamp.from(to));
        }
        return this;
    }

    /**
     * Full query as a substring of either field, or any token inside the primary field. A browse query adds
     * nothing.
     */
    SqlCriteria andTextMatch(String primary, String secondary, SearchQuery query) {
        if (query.isBrowse()) {
            return this;
        }
        StringBuilder clause = new StringBuilder("(LOWER(").append(primary).append(") LIKE ?").append(ESCAPE);
        params.add(containsPattern(query.getNormalizedText()));
        if (secondary != null) {
            clause.append(" OR LOWER(COALESCE(").append(secondary).append(", '')) LIKE ?").append(ESCAPE);
            params.add(containsPattern(query.getNormalizedText()));
        }
        for (String token : query.getTokens()) {
            clause.append(" OR LOWER(").append(primary).append(") LIKE ?").append(ESCAPE);
            params.add(containsPattern(token));
        }
        clauses.add(clause.append(")").toString());
        return this;
    }

    String whereClause() {
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    Object[] params() {
        return params.toArray();
    }

    Object[] paramsWith(Object extra) {
        List<Object> copy = new ArrayList<>(params);
        copy.add(extra);
        return copy.toArray();
    }

    static String containsPattern(String value) {
        return "%" + escapeLike(value == null ? "" : value.toLowerCase(Locale.ROOT)) + "%";
    }

    static String escapeLike(String value) {
        StringBuilder out = new StringBuilder(value.length() + 4);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '\\' || ch == '%' || ch == '_') {
                out.append('\\');
            }
            out.append(ch);
        }
        return out.toString();
    }

    static String placeholders(int count) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                out.append(", ");
            }
            out.append('?');
        }
        return out.toString();
    }
}
