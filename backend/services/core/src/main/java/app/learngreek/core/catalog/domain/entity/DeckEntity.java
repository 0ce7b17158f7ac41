package app.learngreek.core.catalog.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "decks", schema = "app_core")
public class DeckEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "deck_id", nullable = false)
    private UUID deckId;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "deck_type", nullable = false)
    private DeckType deckType;

    // Culture decks only: history, geography, politics, culture, ...
    @Column(name = "category")
    private String category;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected DeckEntity() {
    }

    public DeckEntity(String name, DeckType deckType, String category, boolean active, Instant createdAt) {
        this.name = name;
        this.deckType = deckType;
        this.category = category;
        this.active = active;
        this.createdAt = createdAt;
    }

    public UUID getDeckId() {
        return deckId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public DeckType getDeckType() {
        return deckType;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
