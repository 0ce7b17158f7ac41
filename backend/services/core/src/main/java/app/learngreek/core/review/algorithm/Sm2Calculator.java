package app.learngreek.core.review.algorithm;

import app.learngreek.core.review.domain.ReviewOutcome;
import app.learngreek.core.review.domain.SchedulingState;
import app.learngreek.core.review.domain.Stage;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SM-2 variant working at day granularity.
 *
 * <p>The easiness factor is updated on every answer, passing or not, and clamped to the
 * configured bounds. A failing answer (quality below 3) restarts the item at a one-day
 * interval; passing answers walk 1 day, 6 days, then {@code round(interval * newEf)} with
 * ties going to the even day. The interval has no upper bound here.
 *
 * <p>Instances hold no mutable state. Callers must serialize updates of the same
 * learner/item pair, since read-compute-write is not atomic.
 */
@Component
public class Sm2Calculator {

    static final int FIRST_INTERVAL_DAYS = 1;
    static final int SECOND_INTERVAL_DAYS = 6;
    static final int RELEARNING_INTERVAL_DAYS = 1;

    private final SchedulingConfig config;
    private final StageClassifier stageClassifier;

    public Sm2Calculator(SchedulingConfig config, StageClassifier stageClassifier) {
        this.config = config;
        this.stageClassifier = stageClassifier;
    }

    public SchedulingState initialState() {
        return SchedulingState.initial(config.initialEasinessFactor());
    }

    public SchedulingState calculateNextState(SchedulingState current, int quality, LocalDate today) {
        ReviewOutcome.requireValidQuality(quality);

        double ef = nextEasinessFactor(current.easinessFactor(), quality);
        boolean passed = quality >= ReviewOutcome.PASSING_QUALITY;

        int repetitions;
        int interval;
        if (!passed) {
            repetitions = 0;
            interval = RELEARNING_INTERVAL_DAYS;
        } else {
            repetitions = current.repetitions() + 1;
            if (repetitions == 1) {
                interval = FIRST_INTERVAL_DAYS;
            } else if (repetitions == 2) {
                interval = SECOND_INTERVAL_DAYS;
            } else {
                interval = (int) Math.rint(current.intervalDays() * ef);
            }
        }

        boolean everSucceeded = current.everSucceeded() || passed;
        Stage stage = stageClassifier.classify(repetitions, interval, everSucceeded);

        return new SchedulingState(ef, interval, repetitions, today.plusDays(interval), everSucceeded, stage);
    }

    public Map<Integer, LocalDate> previewNextReviewDates(SchedulingState current, LocalDate today) {
        Map<Integer, LocalDate> out = new LinkedHashMap<>();
        for (int q = ReviewOutcome.MIN_QUALITY; q <= ReviewOutcome.MAX_QUALITY; q++) {
            out.put(q, calculateNextState(current, q, today).nextReviewDate());
        }
        return out;
    }

    double nextEasinessFactor(double ef, int quality) {
        int miss = ReviewOutcome.MAX_QUALITY - quality;
        double next = ef + (0.1 - miss * (0.08 + miss * 0.02));
        return clamp(next, config.minEasinessFactor(), config.maxEasinessFactor());
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
