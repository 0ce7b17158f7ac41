package app.learngreek.core.review.queue;

import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.domain.SchedulingState;

import java.util.UUID;

/**
 * An item the learner has already answered, with its scheduling state.
 *
 * @param creationOrder stable secondary sort key, ties on the review date are broken by it
 */
public record ItemState(
        UUID itemId,
        ItemKind itemKind,
        SchedulingState state,
        long creationOrder
) {
}
