package app.learngreek.core.review.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public record BulkReviewRequest(
        UUID sessionId,
        @NotEmpty @Size(max = 100) List<@Valid SubmitReviewRequest> reviews
) {
}
