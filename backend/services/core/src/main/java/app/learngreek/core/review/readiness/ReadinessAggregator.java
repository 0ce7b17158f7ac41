package app.learngreek.core.review.readiness;

import app.learngreek.core.review.algorithm.SchedulingConfig;
import app.learngreek.core.review.algorithm.StageClassifier;
import app.learngreek.core.review.domain.ReadinessVerdict;
import app.learngreek.core.review.domain.Stage;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Weighted exam-readiness over a category-filtered set of items. Percentages are rounded
 * half-up to one decimal place and the verdict is taken from the rounded score.
 * Each item is weighted by the stage its numbers classify to, not by its stored label.
 */
@Component
public class ReadinessAggregator {

    private final SchedulingConfig config;
    private final StageClassifier stageClassifier;

    public ReadinessAggregator(SchedulingConfig config, StageClassifier stageClassifier) {
        this.config = config;
        this.stageClassifier = stageClassifier;
    }

    public ReadinessResult compute(Collection<CategorizedState> states, Set<String> includedCategories) {
        return compute(states, includedCategories, AnswerTally.NONE);
    }

    public ReadinessResult compute(Collection<CategorizedState> states,
                                   Set<String> includedCategories,
                                   AnswerTally answers) {
        Map<String, Tally> byCategory = new TreeMap<>();
        Tally overall = new Tally();

        if (states != null && includedCategories != null) {
            for (CategorizedState cs : states) {
                if (cs.category() == null || !includedCategories.contains(cs.category())) {
                    continue;
                }
                Stage stage = stageClassifier.classify(cs.state());
                overall.add(weight(stage), stage == Stage.MASTERED);
                byCategory.computeIfAbsent(cs.category(), c -> new Tally())
                        .add(weight(stage), stage == Stage.MASTERED);
            }
        }

        double score = overall.percentage();
        List<CategoryReadiness> categories = new ArrayList<>();
        byCategory.forEach((category, t) ->
                categories.add(new CategoryReadiness(category, t.percentage(), t.mastered, t.total)));
        categories.sort(Comparator.comparingDouble(CategoryReadiness::readinessPercentage)
                .thenComparing(CategoryReadiness::category));

        AnswerTally tally = answers == null ? AnswerTally.NONE : answers;
        Double accuracy = tally.totalAnswers() > 0
                ? round1(tally.correctAnswers() * 100.0 / tally.totalAnswers())
                : null;

        return new ReadinessResult(
                score,
                verdict(score),
                overall.mastered,
                overall.total,
                accuracy,
                tally.totalAnswers(),
                List.copyOf(categories)
        );
    }

    public double weight(Stage stage) {
        if (stage == null) {
            return 0;
        }
        return switch (stage) {
            case LEARNING -> config.learningWeight();
            case REVIEW -> config.reviewWeight();
            case MASTERED -> config.masteredWeight();
            default -> 0;
        };
    }

    public ReadinessVerdict verdict(double score) {
        if (score >= config.thoroughlyPreparedThreshold()) return ReadinessVerdict.THOROUGHLY_PREPARED;
        if (score >= config.readyThreshold()) return ReadinessVerdict.READY;
        if (score >= config.gettingThereThreshold()) return ReadinessVerdict.GETTING_THERE;
        return ReadinessVerdict.NOT_READY;
    }

    private static double round1(double v) {
        return BigDecimal.valueOf(v).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    private static final class Tally {
        private double weightSum;
        private int mastered;
        private int total;

        void add(double weight, boolean isMastered) {
            weightSum += weight;
            total++;
            if (isMastered) mastered++;
        }

        double percentage() {
            if (total == 0) return 0.0;
            return round1(weightSum * 100.0 / total);
        }
    }
}
