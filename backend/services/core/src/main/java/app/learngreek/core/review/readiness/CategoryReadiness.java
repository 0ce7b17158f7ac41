package app.learngreek.core.review.readiness;

public record CategoryReadiness(
        String category,
        double readinessPercentage,
        int questionsMastered,
        int questionsTotal
) {
}
