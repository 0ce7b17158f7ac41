package app.learngreek.core.review.controller.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record CultureAnswerRequest(
        @NotNull Integer selectedOption,
        @PositiveOrZero Double responseTimeSeconds
) {
}
