package app.learngreek.core.review.domain;

import java.util.UUID;

public class DeckNotFoundException extends RuntimeException {

    public DeckNotFoundException(ItemKind kind, UUID deckId) {
        super("Deck not found: " + deckId + " for " + kind);
    }
}
