package app.learngreek.core.review.queue;

import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.domain.Stage;

import java.time.LocalDate;
import java.util.UUID;

public record QueueEntry(
        UUID itemId,
        ItemKind itemKind,
        boolean isNew,
        boolean earlyPractice,
        Stage stage,
        LocalDate dueDate,
        Double easinessFactor,
        Integer intervalDays
) {

    static QueueEntry scheduled(ItemState item, boolean earlyPractice) {
        var s = item.state();
        return new QueueEntry(
                item.itemId(),
                item.itemKind(),
                false,
                earlyPractice,
                s.stage(),
                s.nextReviewDate(),
                s.easinessFactor(),
                s.intervalDays()
        );
    }

    static QueueEntry fresh(ItemCandidate candidate) {
        return new QueueEntry(
                candidate.itemId(),
                candidate.itemKind(),
                true,
                false,
                Stage.NEW,
                null,
                null,
                null
        );
    }
}
