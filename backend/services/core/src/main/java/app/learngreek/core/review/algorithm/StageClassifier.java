package app.learngreek.core.review.algorithm;

import app.learngreek.core.review.domain.SchedulingState;
import app.learngreek.core.review.domain.Stage;
import org.springframework.stereotype.Component;

@Component
public class StageClassifier {

    private final SchedulingConfig config;

    public StageClassifier(SchedulingConfig config) {
        this.config = config;
    }

    public Stage classify(SchedulingState state) {
        return classify(state.repetitions(), state.intervalDays(), state.everSucceeded());
    }

    public Stage classify(int repetitions, int intervalDays, boolean everSucceeded) {
        if (repetitions == 0) {
            return everSucceeded ? Stage.RELEARNING : Stage.NEW;
        }
        if (intervalDays >= config.masteredThresholdDays()) {
            return Stage.MASTERED;
        }
        if (intervalDays >= config.reviewThresholdDays()) {
            return Stage.REVIEW;
        }
        return Stage.LEARNING;
    }
}
