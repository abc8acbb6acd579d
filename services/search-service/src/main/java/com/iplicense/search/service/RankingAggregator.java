package com.iplicense.search.service;

import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.SearchQuery;
import com.iplicense.search.query.SortDirective;
import com.iplicense.search.query.SortField;
import com.iplicense.search.query.SortOrder;
import com.iplicense.search.scoring.ScoredResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Merges scored candidates from every responding adapter, orders them, and cuts the requested page.
 * The page is taken only after the full merge and sort.
 */
@Component
public class RankingAggregator {
    static final Comparator<ScoredResult> RELEVANCE_ORDER = Comparator
        .comparingDouble(ScoredResult::composite).reversed()
        .thenComparing(result -> result.candidate().createdAt(), Comparator.nullsLast(Comparator.reverseOrder()))
        .thenComparing(result -> result.candidate().id());

    public RankedPage aggregate(SearchQuery query, List<ScoredResult> scored, Map<EntityKind, Long> totals) {
        List<ScoredResult> ordered = new ArrayList<>(scored == null ? List.of() : scored);
        ordered.sort(comparator(query.getSort()));

        int pageSize = query.getPageSize();
        long total = ordered.size();
        int totalPages = (int) ((total + pageSize - 1) / pageSize);

        long offset = (long) (query.getPage() - 1) * pageSize;
        List<ScoredResult> page;
        if (offset >= total) {
            page = List.of();
        } else {
            int from = (int) offset;
            page = ordered.subList(from, (int) Math.min(total, offset + pageSize));
        }

        Map<EntityKind, Long> entityCounts = new EnumMap<>(EntityKind.class);
        if (totals != null) {
            entityCounts.putAll(totals);
        }
        return new RankedPage(page, query.getPage(), pageSize, total, totalPages, entityCounts);
    }

    static Comparator<ScoredResult> comparator(SortDirective sort) {
        if (sort == null || sort.isRelevance()) {
            return RELEVANCE_ORDER;
        }
        SortField field = sort.field();
        Comparator<ScoredResult> byField = switch (field) {
            case TITLE -> byKey(result -> lowerOrNull(result.candidate().title()), sort.order());
            case CREATED_AT -> byKey(result -> result.candidate().createdAt(), sort.order());
            case UPDATED_AT -> byKey(result -> result.candidate().updatedAt(), sort.order());
            default -> byKey(result -> result.candidate().sortMetric(field.value()), sort.order());
        };
        return byField.thenComparing(RELEVANCE_ORDER);
    }

    // missing values always sort after present ones, whatever the direction
    private static <T extends Comparable<? super T>> Comparator<ScoredResult> byKey(
        Function<ScoredResult, T> key,
        SortOrder order
    ) {
        Comparator<T> natural = order == SortOrder.ASC ? Comparator.naturalOrder() : Comparator.reverseOrder();
        return Comparator.comparing(key, Comparator.nullsLast(natural));
    }

    private static String lowerOrNull(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
