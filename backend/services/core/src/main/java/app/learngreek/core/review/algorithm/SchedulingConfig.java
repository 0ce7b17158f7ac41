package app.learngreek.core.review.algorithm;

/**
 * Immutable tuning constants for the scheduling engine. Built once from configuration
 * and handed to the calculator, classifier, queue builder and readiness aggregator.
 */
public record SchedulingConfig(
        double minEasinessFactor,
        double maxEasinessFactor,
        double initialEasinessFactor,
        int learningThresholdDays,
        int reviewThresholdDays,
        int masteredThresholdDays,
        double learningWeight,
        double reviewWeight,
        double masteredWeight,
        double thoroughlyPreparedThreshold,
        double readyThreshold,
        double gettingThereThreshold,
        int defaultMaxDue,
        int defaultMaxNew,
        int defaultMaxEarlyPractice
) {

    public SchedulingConfig {
        if (minEasinessFactor <= 0 || minEasinessFactor > maxEasinessFactor) {
            throw new IllegalArgumentException("Invalid easiness bounds: [" + minEasinessFactor + ", " + maxEasinessFactor + "]");
        }
        if (initialEasinessFactor < minEasinessFactor || initialEasinessFactor > maxEasinessFactor) {
            throw new IllegalArgumentException("Initial easiness factor " + initialEasinessFactor + " is outside bounds");
        }
        if (learningThresholdDays > reviewThresholdDays || reviewThresholdDays > masteredThresholdDays) {
            throw new IllegalArgumentException("Stage thresholds must be ascending: "
                    + learningThresholdDays + "/" + reviewThresholdDays + "/" + masteredThresholdDays);
        }
        if (gettingThereThreshold > readyThreshold || readyThreshold > thoroughlyPreparedThreshold) {
            throw new IllegalArgumentException("Verdict thresholds must be ascending: "
                    + gettingThereThreshold + "/" + readyThreshold + "/" + thoroughlyPreparedThreshold);
        }
    }

    public static SchedulingConfig defaults() {
        return new SchedulingConfig(
                1.3, 3.0, 2.5,
                1, 7, 21,
                0.25, 0.5, 1.0,
                85.0, 60.0, 40.0,
                20, 10, 10
        );
    }
}
