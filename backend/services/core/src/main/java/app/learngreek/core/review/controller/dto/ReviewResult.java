package app.learngreek.core.review.controller.dto;

import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.domain.Stage;

import java.time.LocalDate;
import java.util.UUID;

public record ReviewResult(
        UUID itemId,
        ItemKind itemKind,
        int quality,
        Stage previousStage,
        Stage stage,
        double easinessFactor,
        int intervalDays,
        int repetitions,
        LocalDate nextReviewDate
) {
}
