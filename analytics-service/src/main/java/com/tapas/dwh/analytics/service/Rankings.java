package com.tapas.dwh.analytics.service;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Orderings and ranks shared by the reports. Nulls sort lowest: first ascending,
 * last descending.
 */
final class Rankings {

    static final Comparator<BigDecimal> ASCENDING = Comparator.nullsFirst(Comparator.<BigDecimal>naturalOrder());
    static final Comparator<BigDecimal> DESCENDING = Comparator.nullsLast(Comparator.<BigDecimal>reverseOrder());
    static final Comparator<String> TEXT = Comparator.nullsFirst(Comparator.<String>naturalOrder());
    static final Comparator<Long> KEY = Comparator.nullsFirst(Comparator.<Long>naturalOrder());

    private Rankings() {
    }

    /**
     * Competition ranks ("1224") of rows already sorted by the rank value. Equal values,
     * two nulls included, share a rank; the next distinct value ranks one past the
     * number of rows above it.
     */
    static <T> int[] competitionRanks(List<T> sorted, Function<T, BigDecimal> rankValue) {
        int[] ranks = new int[sorted.size()];
        for (int i = 0; i < sorted.size(); i++) {
            if (i > 0 && sameValue(rankValue.apply(sorted.get(i - 1)), rankValue.apply(sorted.get(i)))) {
                ranks[i] = ranks[i - 1];
            } else {
                ranks[i] = i + 1;
            }
        }
        return ranks;
    }

    static <T> List<T> limit(List<T> sorted, int limit) {
        requirePositiveLimit(limit);
        return sorted.size() <= limit ? sorted : List.copyOf(sorted.subList(0, limit));
    }

    static void requirePositiveLimit(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, was " + limit);
        }
    }

    private static boolean sameValue(BigDecimal left, BigDecimal right) {
        if (left == null || right == null) {
            return Objects.equals(left, right);
        }
        return left.compareTo(right) == 0;
    }
}
