package app.learngreek.core.review.domain;

import java.time.LocalDate;

/**
 * Scheduling state of one learner/item pair.
 *
 * <p>{@code stage} is derived from the numeric fields and recomputed on every write.
 * {@code everSucceeded} records whether the item has ever been answered correctly, which
 * is what separates {@link Stage#RELEARNING} from {@link Stage#NEW} once repetitions drop to zero.
 */
public record SchedulingState(
        double easinessFactor,
        int intervalDays,
        int repetitions,
        LocalDate nextReviewDate,
        boolean everSucceeded,
        Stage stage
) {

    public static SchedulingState initial(double initialEasinessFactor) {
        return new SchedulingState(initialEasinessFactor, 0, 0, null, false, Stage.NEW);
    }

    public boolean isDueOn(LocalDate day) {
        return nextReviewDate != null && !nextReviewDate.isAfter(day);
    }
}
