package net.chapterone.domain.context;

import jakarta.annotation.Nullable;

/**
 * Situational signals supplied by the caller when asking for a recommendation.
 *
 * <p>All fields are optional. Values outside the encoder vocabulary are accepted and
 * encoded into the reserved unknown slots.</p>
 *
 * @param mood how the reader feels (e.g. "curious", "relaxed")
 * @param situation where or when the reader is reading (e.g. "commuting", "before_bed")
 * @param goal what the reader wants out of the book (e.g. "learning", "escape")
 * @param timeOfDay one of morning, afternoon, evening, night
 * @param dayOfWeek ISO day of week, 1 (Monday) to 7 (Sunday)
 */
public record ReadingContext(
    @Nullable String mood,
    @Nullable String situation,
    @Nullable String goal,
    @Nullable String timeOfDay,
    @Nullable Integer dayOfWeek
) {

    public ReadingContext(String mood, String situation, String goal, String timeOfDay) {
        this(mood, situation, goal, timeOfDay, null);
    }

    /** A context with no signals at all; encodes to the all-unknown vector. */
    public static ReadingContext empty() {
        return new ReadingContext(null, null, null, null, null);
    }
}
