package app.learngreek.core.review.queue;

import app.learngreek.core.review.domain.ItemKind;

import java.util.UUID;

/**
 * A catalog item the learner has never answered.
 */
public record ItemCandidate(
        UUID itemId,
        ItemKind itemKind,
        int orderIndex
) {
}
