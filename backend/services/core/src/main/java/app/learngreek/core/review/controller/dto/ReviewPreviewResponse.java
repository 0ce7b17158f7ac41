package app.learngreek.core.review.controller.dto;

import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.domain.Stage;

import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * @param nextReviewDates next review date keyed by quality 1..5
 */
public record ReviewPreviewResponse(
        UUID itemId,
        ItemKind itemKind,
        Stage stage,
        Map<Integer, LocalDate> nextReviewDates
) {
}
