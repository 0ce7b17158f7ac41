package app.learngreek.core.catalog.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "cards", schema = "app_core")
public class CardEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "card_id", nullable = false)
    private UUID cardId;

    @Column(name = "deck_id", nullable = false)
    private UUID deckId;

    @Column(name = "front_text", nullable = false)
    private String frontText;

    @Column(name = "back_text", nullable = false)
    private String backText;

    @Column(name = "order_index", nullable = false)
    private int orderIndex;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected CardEntity() {
    }

    public CardEntity(UUID deckId, String frontText, String backText, int orderIndex, Instant createdAt) {
        this.deckId = deckId;
        this.frontText = frontText;
        this.backText = backText;
        this.orderIndex = orderIndex;
        this.createdAt = createdAt;
    }

    public UUID getCardId() {
        return cardId;
    }

    public UUID getDeckId() {
        return deckId;
    }

    public String getFrontText() {
        return frontText;
    }

    public String getBackText() {
        return backText;
    }

    public int getOrderIndex() {
        return orderIndex;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
