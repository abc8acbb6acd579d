package com.iplicense.search.suggest;

import java.util.Locale;

/**
 * Levenshtein distance over UTF-16 code units, two rows at a time.
 */
public final class EditDistance {
    private EditDistance() {
    }

    public static int between(String left, String right) {
        if (left.equals(right)) {
            return 0;
        }
        if (left.isEmpty()) {
            return right.length();
        }
        if (right.isEmpty()) {
            return left.length();
        }
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= left.length(); i++) {
            current[0] = i;
            char c = left.charAt(i - 1);
            for (int j = 1; j <= right.length(); j++) {
                if (c == right.charAt(j - 1)) {
                    current[j] = previous[j - 1];
                } else {
                    current[j] = 1 + Math.min(previous[j - 1], Math.min(current[j - 1], previous[j]));
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }

    /** 1 minus the distance over the longer length, case-insensitive. */
    public static double similarity(String left, String right) {
        int maxLength = Math.max(left.length(), right.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - (double) between(left.toLowerCase(Locale.ROOT), right.toLowerCase(Locale.ROOT)) / maxLength;
    }
}
