package app.learngreek.core.review.domain;

import java.time.Instant;

/**
 * A single answer event. Folded into the item's {@link SchedulingState} and the review log.
 * Scheduling works at day granularity: only the calendar date of {@code answeredAt} matters.
 *
 * @param quality             1 (complete failure) to 5 (perfect recall)
 * @param responseTimeSeconds already capped by the caller
 * @param answeredAt          moment the answer was given
 */
public record ReviewOutcome(
        int quality,
        double responseTimeSeconds,
        Instant answeredAt
) {
    public static final int MIN_QUALITY = 1;
    public static final int MAX_QUALITY = 5;
    public static final int PASSING_QUALITY = 3;

    public static void requireValidQuality(int quality) {
        if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
            throw new InvalidQualityException(quality);
        }
    }
}
