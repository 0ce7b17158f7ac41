package app.learngreek.core.review.controller.dto;

import app.learngreek.core.review.domain.ItemKind;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.UUID;

// quality range is enforced by the scheduler, out-of-range values surface as 422
public record SubmitReviewRequest(
        @NotNull ItemKind itemKind,
        @NotNull UUID itemId,
        @NotNull Integer quality,
        @PositiveOrZero Double responseTimeSeconds
) {
}
