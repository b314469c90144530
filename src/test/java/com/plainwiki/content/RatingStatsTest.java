package com.plainwiki.content;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RatingStatsTest {

    @Test
    void withScoreUpdatesAverage() {
        RatingStats stats = new RatingStats(0, 0, 0).withScore(4).withScore(2);
        assertEquals(6, stats.getTotal());
        assertEquals(2, stats.getTimesRated());
        assertEquals(3, stats.getRating());
    }

    @Test
    void rejectsNonFiniteScores() {
        RatingStats stats = new RatingStats(0, 0, 0);
        assertThrows(IllegalArgumentException.class, () -> stats.withScore(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> stats.withScore(Double.POSITIVE_INFINITY));
    }

    @Test
    void missingOrBadValuesReadAsZero() {
        Map<String, String> meta = new HashMap<>();
        meta.put(RatingStats.TOTAL, "lots");
        RatingStats stats = RatingStats.fromMeta(meta);
        assertEquals(0, stats.getTotal());
        assertEquals(0, stats.getTimesRated());
    }

    @Test
    void writesAllThreeKeys() {
        Map<String, String> meta = new HashMap<>();
        new RatingStats(0, 0, 0).withScore(5).withScore(2).writeTo(meta);
        assertEquals("7", meta.get(RatingStats.TOTAL));
        assertEquals("2", meta.get(RatingStats.TIMES_RATED));
        assertEquals("3.5", meta.get(RatingStats.RATING));
    }

    @Test
    void legacyFoldOnlyTouchesExistingKeys() {
        Map<String, String> meta = new HashMap<>();
        meta.put(RatingStats.RATING, "5");
        RatingStats.legacyFold(meta);
        assertEquals("5", meta.get(RatingStats.RATING));
        assertFalse(meta.containsKey(RatingStats.TOTAL));
        assertFalse(meta.containsKey(RatingStats.TIMES_RATED));
    }
}
