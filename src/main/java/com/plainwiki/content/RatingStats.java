package com.plainwiki.content;

import java.util.Map;

/**
 * Rolling average kept in the reserved header keys {@code total},
 * {@code timesrated} and {@code rating}.
 */
public final class RatingStats {

    public static final String TOTAL = "total";
    public static final String TIMES_RATED = "timesrated";
    public static final String RATING = "rating";

    private final double total;
    private final int timesRated;
    private final double rating;

    public RatingStats(double total, int timesRated, double rating) {
        this.total = total;
        this.timesRated = timesRated;
        this.rating = rating;
    }

    public static RatingStats fromMeta(Map<String, String> meta) {
        return new RatingStats(
            parseNumber(meta.get(TOTAL)),
            (int) parseNumber(meta.get(TIMES_RATED)),
            parseNumber(meta.get(RATING)));
    }

    /**
     * Add one score; {@code rating} becomes the new average.
     */
    public RatingStats withScore(double score) {
        if (Double.isNaN(score) || Double.isInfinite(score)) {
            throw new IllegalArgumentException("Score must be a finite number: " + score);
        }
        double newTotal = total + score;
        int newTimes = timesRated + 1;
        return new RatingStats(newTotal, newTimes, newTotal / newTimes);
    }

    /**
     * The historic fold applied while parsing: the stored rating counts as a new
     * score on every read. {@code timesrated} starts at 1 when absent.
     */
    public static void legacyFold(Map<String, String> meta) {
        double storedTotal = parseNumber(meta.get(TOTAL));
        int times = meta.containsKey(TIMES_RATED) ? (int) parseNumber(meta.get(TIMES_RATED)) + 1 : 1;
        double newTotal = parseNumber(meta.get(RATING)) + storedTotal;
        String average = formatNumber(newTotal / times);

        if (meta.containsKey(TOTAL)) {
            meta.put(TOTAL, formatNumber(newTotal));
        }
        if (meta.containsKey(TIMES_RATED)) {
            meta.put(TIMES_RATED, String.valueOf(times));
        }
        if (meta.containsKey(RATING)) {
            meta.put(RATING, average);
        }
    }

    public void writeTo(Map<String, String> meta) {
        meta.put(TOTAL, formatNumber(total));
        meta.put(TIMES_RATED, String.valueOf(timesRated));
        meta.put(RATING, formatNumber(rating));
    }

    public double getTotal() { return total; }

    public int getTimesRated() { return timesRated; }

    public double getRating() { return rating; }

    public static double parseNumber(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public static String formatNumber(double value) {
        if (!Double.isInfinite(value) && value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
