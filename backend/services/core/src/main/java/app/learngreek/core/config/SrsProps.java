package app.learngreek.core.config;

import app.learngreek.core.review.algorithm.SchedulingConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "app.srs")
public record SrsProps(
        Easiness easiness,
        Stages stages,
        Queue queue,
        Readiness readiness,
        String zone
) {

    public record Easiness(Double min, Double max, Double initial) {
    }

    public record Stages(Integer learningDays, Integer reviewDays, Integer masteredDays) {
    }

    public record Queue(Integer maxDue, Integer maxNew, Integer maxEarlyPractice) {
    }

    public record Readiness(
            Double learningWeight,
            Double reviewWeight,
            Double masteredWeight,
            Double thoroughlyPreparedThreshold,
            Double readyThreshold,
            Double gettingThereThreshold,
            List<String> examCategories
    ) {
    }

    public SchedulingConfig toSchedulingConfig() {
        SchedulingConfig d = SchedulingConfig.defaults();
        Easiness e = easiness == null ? new Easiness(null, null, null) : easiness;
        Stages s = stages == null ? new Stages(null, null, null) : stages;
        Queue q = queue == null ? new Queue(null, null, null) : queue;
        Readiness r = readiness == null ? new Readiness(null, null, null, null, null, null, null) : readiness;

        return new SchedulingConfig(
                or(e.min(), d.minEasinessFactor()),
                or(e.max(), d.maxEasinessFactor()),
                or(e.initial(), d.initialEasinessFactor()),
                or(s.learningDays(), d.learningThresholdDays()),
                or(s.reviewDays(), d.reviewThresholdDays()),
                or(s.masteredDays(), d.masteredThresholdDays()),
                or(r.learningWeight(), d.learningWeight()),
                or(r.reviewWeight(), d.reviewWeight()),
                or(r.masteredWeight(), d.masteredWeight()),
                or(r.thoroughlyPreparedThreshold(), d.thoroughlyPreparedThreshold()),
                or(r.readyThreshold(), d.readyThreshold()),
                or(r.gettingThereThreshold(), d.gettingThereThreshold()),
                or(q.maxDue(), d.defaultMaxDue()),
                or(q.maxNew(), d.defaultMaxNew()),
                or(q.maxEarlyPractice(), d.defaultMaxEarlyPractice())
        );
    }

    public List<String> examCategories() {
        if (readiness == null || readiness.examCategories() == null || readiness.examCategories().isEmpty()) {
            return List.of("history", "geography", "politics", "culture");
        }
        return List.copyOf(readiness.examCategories());
    }

    private static <T> T or(T value, T fallback) {
        return value == null ? fallback : value;
    }
}
