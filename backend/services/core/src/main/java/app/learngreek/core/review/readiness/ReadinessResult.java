package app.learngreek.core.review.readiness;

import app.learngreek.core.review.domain.ReadinessVerdict;

import java.util.List;

/**
 * @param readinessPercentage weighted score in {@code [0, 100]}, one decimal place
 * @param questionsLearned    items whose stage is mastered; not weighted
 * @param accuracyPercentage  {@code null} when no answers were recorded
 * @param categories          per-category breakdown, weakest first
 */
public record ReadinessResult(
        double readinessPercentage,
        ReadinessVerdict verdict,
        int questionsLearned,
        int questionsTotal,
        Double accuracyPercentage,
        long totalAnswers,
        List<CategoryReadiness> categories
) {
}
