package com.iplicense.search.facet;

import com.iplicense.search.adapter.EntityAdapter;
import com.iplicense.search.adapter.FacetCount;
import com.iplicense.search.common.PermissionContext;
import com.iplicense.search.config.SearchConfig;
import com.iplicense.search.config.SearchConfigService;
import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.FacetField;
import com.iplicense.search.query.QueryNormalizer;
import com.iplicense.search.query.SearchFilters;
import com.iplicense.search.query.SearchQuery;
import com.iplicense.search.service.AdapterFanOut;
import com.iplicense.search.service.AdapterOutcome;
import com.iplicense.search.service.SearchCancelledException;
import com.iplicense.search.service.SearchUnavailableException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-value counts for the filter fields of the requested kinds. A field's counts honour the query text and
 * every other filter but not the field's own selection, so unselected values stay visible.
 */
@Service
public class FacetService {
    private static final Logger log = LoggerFactory.getLogger(FacetService.class);

    private final QueryNormalizer normalizer;
    private final SearchConfigService configService;
    private final AdapterFanOut fanOut;

    public FacetService(QueryNormalizer normalizer, SearchConfigService configService, AdapterFanOut fanOut) {
        this.normalizer = normalizer;
        this.configService = configService;
        this.fanOut = fanOut;
    }

    record KindFacets(long total, Map<FacetField, List<FacetCount>> counts) {}

    /**
     * @throws com.iplicense.search.query.InvalidSearchRequestException when the request is malformed
     * @throws SearchUnavailableException when every requested adapter failed
     */
    public FacetsOutcome facets(String rawText, List<String> entities, SearchFilters filters, PermissionContext permissions) {
        long started = System.nanoTime();
        SearchConfig config = configService.current();
        SearchQuery query = normalizer.normalizeForFacets(rawText, entities, filters, config);
        PermissionContext caller = permissions == null ? PermissionContext.ANONYMOUS : permissions;

        Map<EntityKind, AdapterOutcome<KindFacets>> outcomes;
        try {
            outcomes = fanOut.run(
                "facets",
                query.getEntityKinds(),
                started,
                (adapter, budget) -> countKind(adapter, query, caller, budget)
            );
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SearchCancelledException("facets cancelled while waiting for adapters", ex);
        }

        Map<FacetField, List<FacetCount>> counts = new EnumMap<>(FacetField.class);
        List<EntityKind> unavailable = new ArrayList<>();
        long total = 0L;
        for (AdapterOutcome<KindFacets> outcome : outcomes.values()) {
            if (outcome.isError()) {
                unavailable.add(outcome.getKind());
                continue;
            }
            total += outcome.getResult().total();
            counts.putAll(outcome.getResult().counts());
        }
        if (!outcomes.isEmpty() && unavailable.size() == outcomes.size()) {
            throw new SearchUnavailableException(unavailable);
        }

        List<FacetGroup> groups = new ArrayList<>();
        for (Map.Entry<FacetField, List<FacetCount>> entry : counts.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            FacetField field = entry.getKey();
            List<String> selected = field.selected(query.getFilters());
            List<FacetOption> options = new ArrayList<>(entry.getValue().size());
            for (FacetCount count : entry.getValue()) {
                options.add(new FacetOption(count.value(), count.value(), count.count(), selected.contains(count.value())));
            }
            groups.add(new FacetGroup(field, field.label(), FacetGroup.CHECKBOX, options));
        }
        log.debug(
            "facets done groups={} total={} partial={} took_ms={}",
            groups.size(),
            total,
            !unavailable.isEmpty(),
            (System.nanoTime() - started) / 1_000_000L
        );
        return new FacetsOutcome(groups, total, unavailable);
    }

    // statements run one after another on the worker, each with whatever budget is left
    private static KindFacets countKind(
        EntityAdapter adapter,
        SearchQuery query,
        PermissionContext caller,
        Duration budget
    ) {
        long deadlineNs = System.nanoTime() + budget.toNanos();
        long total = adapter.count(query, caller, budget);
        Map<FacetField, List<FacetCount>> counts = new EnumMap<>(FacetField.class);
        for (FacetField field : FacetField.values()) {
            if (!adapter.facetFields().contains(field)) {
                continue;
            }
            Duration left = Duration.ofNanos(Math.max(1L, deadlineNs - System.nanoTime()));
            counts.put(field, adapter.facetCounts(field, query, caller, left));
        }
        return new KindFacets(total, counts);
    }
}
