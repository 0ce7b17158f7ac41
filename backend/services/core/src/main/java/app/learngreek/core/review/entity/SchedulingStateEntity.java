package app.learngreek.core.review.entity;

import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.domain.SchedulingState;
import app.learngreek.core.review.domain.Stage;
import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(
        name = "item_scheduling_states",
        schema = "app_core",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_scheduling_state_learner_item",
                columnNames = {"learner_id", "item_kind", "item_id"}
        )
)
public class SchedulingStateEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "learner_id", nullable = false)
    private UUID learnerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "item_kind", nullable = false)
    private ItemKind itemKind;

    @Column(name = "item_id", nullable = false)
    private UUID itemId;

    @Column(name = "deck_id")
    private UUID deckId;

    @Column(name = "easiness_factor", nullable = false)
    private double easinessFactor;

    @Column(name = "interval_days", nullable = false)
    private int intervalDays;

    @Column(name = "repetitions", nullable = false)
    private int repetitions;

    @Column(name = "next_review_date")
    private LocalDate nextReviewDate;

    @Column(name = "ever_succeeded", nullable = false)
    private boolean everSucceeded;

    @Convert(converter = StageConverter.class)
    @Column(name = "stage", nullable = false)
    private Stage stage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "row_version", nullable = false)
    private long rowVersion;

    public SchedulingState toState() {
        return new SchedulingState(easinessFactor, intervalDays, repetitions, nextReviewDate, everSucceeded, stage);
    }

    public void apply(SchedulingState state, Instant now) {
        this.easinessFactor = state.easinessFactor();
        this.intervalDays = state.intervalDays();
        this.repetitions = state.repetitions();
        this.nextReviewDate = state.nextReviewDate();
        this.everSucceeded = state.everSucceeded();
        this.stage = state.stage();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
    }

    public UUID getId() {
        return id;
    }

    public UUID getLearnerId() {
        return learnerId;
    }

    public void setLearnerId(UUID learnerId) {
        this.learnerId = learnerId;
    }

    public ItemKind getItemKind() {
        return itemKind;
    }

    public void setItemKind(ItemKind itemKind) {
        this.itemKind = itemKind;
    }

    public UUID getItemId() {
        return itemId;
    }

    public void setItemId(UUID itemId) {
        this.itemId = itemId;
    }

    public UUID getDeckId() {
        return deckId;
    }

    public void setDeckId(UUID deckId) {
        this.deckId = deckId;
    }

    public double getEasinessFactor() {
        return easinessFactor;
    }

    public int getIntervalDays() {
        return intervalDays;
    }

    public int getRepetitions() {
        return repetitions;
    }

    public LocalDate getNextReviewDate() {
        return nextReviewDate;
    }

    public boolean isEverSucceeded() {
        return everSucceeded;
    }

    public Stage getStage() {
        return stage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getRowVersion() {
        return rowVersion;
    }
}
