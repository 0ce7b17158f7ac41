package app.learngreek.core.review.controller.dto;

import app.learngreek.core.review.domain.ItemKind;

import java.util.Map;

/**
 * @param byStage item counts keyed by stage value; unseen catalog items count as {@code new}
 */
public record StudyStatsResponse(
        ItemKind itemKind,
        Map<String, Long> byStage,
        long dueToday,
        long reviewsToday,
        int currentStreak
) {
}
