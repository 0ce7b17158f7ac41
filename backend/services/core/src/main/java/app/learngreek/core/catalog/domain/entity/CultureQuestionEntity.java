package app.learngreek.core.catalog.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "culture_questions", schema = "app_core")
public class CultureQuestionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "question_id", nullable = false)
    private UUID questionId;

    @Column(name = "deck_id", nullable = false)
    private UUID deckId;

    @Column(name = "question_text", nullable = false)
    private String questionText;

    // 1..4
    @Column(name = "correct_option", nullable = false)
    private short correctOption;

    @Column(name = "order_index", nullable = false)
    private int orderIndex;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected CultureQuestionEntity() {
    }

    public CultureQuestionEntity(UUID deckId, String questionText, int correctOption, int orderIndex, Instant createdAt) {
        this.deckId = deckId;
        this.questionText = questionText;
        this.correctOption = (short) correctOption;
        this.orderIndex = orderIndex;
        this.createdAt = createdAt;
    }

    public UUID getQuestionId() {
        return questionId;
    }

    public UUID getDeckId() {
        return deckId;
    }

    public String getQuestionText() {
        return questionText;
    }

    public int getCorrectOption() {
        return correctOption;
    }

    public int getOrderIndex() {
        return orderIndex;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
