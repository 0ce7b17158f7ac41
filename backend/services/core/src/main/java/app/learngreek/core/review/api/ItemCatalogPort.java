package app.learngreek.core.review.api;

import app.learngreek.core.review.domain.ItemKind;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Read access to the content catalog. Scheduling never touches card or question text,
 * only identity, grouping and ordering.
 */
public interface ItemCatalogPort {

    record CatalogItem(
            UUID itemId,
            ItemKind kind,
            UUID deckId,
            String category,
            int orderIndex
    ) {}

    Optional<CatalogItem> findItem(ItemKind kind, UUID itemId);

    /**
     * Items of the given kind the learner has no scheduling state for, in catalog order.
     *
     * @param deckId optional deck restriction, {@code null} for all active decks
     */
    List<CatalogItem> findNewItems(UUID learnerId, ItemKind kind, UUID deckId, int limit);

    List<CatalogItem> findCultureQuestions(Set<String> categories);

    Optional<Integer> findCorrectOption(UUID questionId);

    long countItems(ItemKind kind);

    /**
     * Whether {@code deckId} names an active deck holding items of the given kind.
     */
    boolean isActiveDeck(ItemKind kind, UUID deckId);
}
