package com.iplicense.search.facet;

import com.iplicense.search.query.FacetField;
import java.util.List;

/** One filter field with a count per value. Every group renders as a checkbox list. */
public record FacetGroup(FacetField field, String label, String type, List<FacetOption> options) {
    public static final String CHECKBOX = "checkbox";

    public FacetGroup {
        options = options == null ? List.of() : List.copyOf(options);
    }
}
