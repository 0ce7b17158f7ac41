package app.learngreek.core.review.queue;

/**
 * Per-session caps. The due and new pools are capped independently; early practice is off
 * unless {@code includeEarlyPractice} is set.
 */
public record QueueLimits(
        int maxDue,
        int maxNew,
        boolean includeEarlyPractice,
        int maxEarlyPractice
) {
    public QueueLimits {
        maxDue = Math.max(0, maxDue);
        maxNew = Math.max(0, maxNew);
        maxEarlyPractice = Math.max(0, maxEarlyPractice);
    }

    public static QueueLimits of(int maxDue, int maxNew) {
        return new QueueLimits(maxDue, maxNew, false, 0);
    }
}
