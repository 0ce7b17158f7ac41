package app.learngreek.core.review.controller.dto;

import app.learngreek.core.review.domain.ItemKind;

import java.util.UUID;

public record BulkReviewItemResult(
        UUID itemId,
        ItemKind itemKind,
        boolean success,
        ReviewResult result,
        String error
) {

    public static BulkReviewItemResult ok(ReviewResult result) {
        return new BulkReviewItemResult(result.itemId(), result.itemKind(), true, result, null);
    }

    public static BulkReviewItemResult failed(UUID itemId, ItemKind itemKind, String error) {
        return new BulkReviewItemResult(itemId, itemKind, false, null, error);
    }
}
