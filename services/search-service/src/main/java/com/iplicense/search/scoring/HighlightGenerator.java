package com.iplicense.search.scoring;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public final class HighlightGenerator {
    private static final String OPEN = "<mark>";
    private static final String CLOSE = "</mark>";

    private HighlightGenerator() {
    }

    public static Map<String, String> highlights(Candidate candidate, String queryText) {
        Map<String, String> highlights = new LinkedHashMap<>();
        String title = highlight(candidate.title(), queryText);
        if (title != null) {
            highlights.put("title", title);
        }
        String description = highlight(candidate.description(), queryText);
        if (description != null) {
            highlights.put("description", description);
        }
        return highlights;
    }

    /**
     * Wraps every case-insensitive literal occurrence of {@code query} in {@code text}.
     *
     * @return the marked-up text, or null when the query does not occur
     */
    public static String highlight(String text, String query) {
        if (text == null || text.isEmpty() || query == null || query.isEmpty()) {
            return null;
        }
        String lowerText = text.toLowerCase(Locale.ROOT);
        String lowerQuery = query.toLowerCase(Locale.ROOT);
        // lowercasing can change length for some scripts; offsets would drift
        if (lowerText.length() != text.length() || lowerQuery.length() != query.length()) {
            return null;
        }
        int index = lowerText.indexOf(lowerQuery);
        if (index < 0) {
            return null;
        }
        StringBuilder out = new StringBuilder(text.length() + 16);
        int cursor = 0;
        while (index >= 0) {
            out.append(text, cursor, index)
                .append(OPEN)
                .append(text, index, index + query.length())
                .append(CLOSE);
            cursor = index + query.length();
            index = lowerText.indexOf(lowerQuery, cursor);
        }
        out.append(text.substring(cursor));
        return out.toString();
    }
}
