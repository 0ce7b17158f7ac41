package app.learngreek.core.review.domain;

import java.util.UUID;

public class ItemNotFoundException extends RuntimeException {

    public ItemNotFoundException(ItemKind kind, UUID itemId) {
        super("Item not found: " + kind + " " + itemId);
    }
}
