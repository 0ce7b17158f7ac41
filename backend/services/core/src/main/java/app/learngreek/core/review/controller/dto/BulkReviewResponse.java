package app.learngreek.core.review.controller.dto;

import java.util.List;
import java.util.UUID;

public record BulkReviewResponse(
        UUID sessionId,
        int totalSubmitted,
        int successful,
        int failed,
        List<BulkReviewItemResult> results
) {
}
