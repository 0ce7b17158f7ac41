package app.learngreek.core.review.entity;

import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.domain.Stage;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "review_logs", schema = "app_core")
public class ReviewLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "learner_id", nullable = false)
    private UUID learnerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "item_kind", nullable = false)
    private ItemKind itemKind;

    @Column(name = "item_id", nullable = false)
    private UUID itemId;

    @Column(name = "quality", nullable = false)
    private short quality;

    @Column(name = "response_time_seconds", nullable = false)
    private double responseTimeSeconds;

    @Column(name = "answered_at", nullable = false)
    private Instant answeredAt;

    @Convert(converter = StageConverter.class)
    @Column(name = "stage_before", nullable = false)
    private Stage stageBefore;

    @Convert(converter = StageConverter.class)
    @Column(name = "stage_after", nullable = false)
    private Stage stageAfter;

    @Column(name = "easiness_factor_after", nullable = false)
    private double easinessFactorAfter;

    @Column(name = "interval_days_after", nullable = false)
    private int intervalDaysAfter;

    public Long getId() {
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

    public short getQuality() {
        return quality;
    }

    public void setQuality(short quality) {
        this.quality = quality;
    }

    public double getResponseTimeSeconds() {
        return responseTimeSeconds;
    }

    public void setResponseTimeSeconds(double responseTimeSeconds) {
        this.responseTimeSeconds = responseTimeSeconds;
    }

    public Instant getAnsweredAt() {
        return answeredAt;
    }

    public void setAnsweredAt(Instant answeredAt) {
        this.answeredAt = answeredAt;
    }

    public Stage getStageBefore() {
        return stageBefore;
    }

    public void setStageBefore(Stage stageBefore) {
        this.stageBefore = stageBefore;
    }

    public Stage getStageAfter() {
        return stageAfter;
    }

    public void setStageAfter(Stage stageAfter) {
        this.stageAfter = stageAfter;
    }

    public double getEasinessFactorAfter() {
        return easinessFactorAfter;
    }

    public void setEasinessFactorAfter(double easinessFactorAfter) {
        this.easinessFactorAfter = easinessFactorAfter;
    }

    public int getIntervalDaysAfter() {
        return intervalDaysAfter;
    }

    public void setIntervalDaysAfter(int intervalDaysAfter) {
        this.intervalDaysAfter = intervalDaysAfter;
    }
}
