package app.learngreek.core.review.readiness;

import app.learngreek.core.review.domain.SchedulingState;

public record CategorizedState(
        String category,
        SchedulingState state
) {
}
