package app.learngreek.core.review.controller.dto;

import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.queue.QueueEntry;

import java.util.List;

public record StudyQueueResponse(
        ItemKind itemKind,
        int dueCount,
        int newCount,
        int earlyPracticeCount,
        int total,
        List<QueueEntry> items
) {
}
