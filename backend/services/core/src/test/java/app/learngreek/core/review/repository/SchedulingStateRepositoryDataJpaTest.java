package app.learngreek.core.review.repository;

import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.domain.SchedulingState;
import app.learngreek.core.review.domain.Stage;
import app.learngreek.core.review.entity.ReviewLogEntity;
import app.learngreek.core.review.entity.SchedulingStateEntity;
import app.learngreek.core.support.PostgresIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class SchedulingStateRepositoryDataJpaTest extends PostgresIntegrationTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);
    private static final Instant NOW = Instant.parse("2025-03-10T08:00:00Z");

    @Autowired
    SchedulingStateRepository stateRepository;

    @Autowired
    ReviewLogRepository logRepository;

    @Test
    void findDue_ordersByDateThenCreation_andHonoursLimit() {
        UUID learnerId = UUID.randomUUID();
        UUID older = save(learnerId, ItemKind.VOCABULARY_CARD, TODAY.minusDays(3), Stage.REVIEW, NOW.minusSeconds(30)).getItemId();
        UUID newer = save(learnerId, ItemKind.VOCABULARY_CARD, TODAY.minusDays(1), Stage.LEARNING, NOW.minusSeconds(20)).getItemId();
        UUID sameDayLater = save(learnerId, ItemKind.VOCABULARY_CARD, TODAY.minusDays(1), Stage.LEARNING, NOW.minusSeconds(10)).getItemId();
        save(learnerId, ItemKind.VOCABULARY_CARD, TODAY.plusDays(1), Stage.LEARNING, NOW);
        save(learnerId, ItemKind.CULTURE_QUESTION, TODAY.minusDays(5), Stage.LEARNING, NOW);
        save(UUID.randomUUID(), ItemKind.VOCABULARY_CARD, TODAY.minusDays(5), Stage.LEARNING, NOW);

        List<SchedulingStateEntity> due = stateRepository.findDue(learnerId, ItemKind.VOCABULARY_CARD, TODAY, PageRequest.of(0, 10));
        List<SchedulingStateEntity> capped = stateRepository.findDue(learnerId, ItemKind.VOCABULARY_CARD, TODAY, PageRequest.of(0, 2));

        assertThat(due).extracting(SchedulingStateEntity::getItemId).containsExactly(older, newer, sameDayLater);
        assertThat(capped).extracting(SchedulingStateEntity::getItemId).containsExactly(older, newer);
        assertThat(stateRepository.countDue(learnerId, ItemKind.VOCABULARY_CARD, TODAY)).isEqualTo(3);
    }

    @Test
    void findUpcoming_onlyLearningAndReviewAfterToday() {
        UUID learnerId = UUID.randomUUID();
        UUID soon = save(learnerId, ItemKind.VOCABULARY_CARD, TODAY.plusDays(1), Stage.LEARNING, NOW).getItemId();
        UUID later = save(learnerId, ItemKind.VOCABULARY_CARD, TODAY.plusDays(9), Stage.REVIEW, NOW).getItemId();
        save(learnerId, ItemKind.VOCABULARY_CARD, TODAY.plusDays(2), Stage.MASTERED, NOW);
        save(learnerId, ItemKind.VOCABULARY_CARD, TODAY, Stage.LEARNING, NOW);

        List<SchedulingStateEntity> upcoming = stateRepository.findUpcoming(learnerId, ItemKind.VOCABULARY_CARD, TODAY,
                List.of(Stage.LEARNING, Stage.REVIEW), PageRequest.of(0, 10));

        assertThat(upcoming).extracting(SchedulingStateEntity::getItemId).containsExactly(soon, later);
    }

    @Test
    void findForUpdate_andStageCounts() {
        UUID learnerId = UUID.randomUUID();
        SchedulingStateEntity saved = save(learnerId, ItemKind.CULTURE_QUESTION, TODAY, Stage.REVIEW, NOW);
        save(learnerId, ItemKind.CULTURE_QUESTION, TODAY, Stage.REVIEW, NOW);
        save(learnerId, ItemKind.CULTURE_QUESTION, TODAY, Stage.MASTERED, NOW);

        assertThat(stateRepository.findForUpdate(learnerId, ItemKind.CULTURE_QUESTION, saved.getItemId()))
                .hasValueSatisfying(e -> assertThat(e.getStage()).isEqualTo(Stage.REVIEW));

        var counts = stateRepository.countByStage(learnerId, ItemKind.CULTURE_QUESTION);
        assertThat(counts).extracting(SchedulingStateRepository.StageCountProjection::getStage)
                .containsExactlyInAnyOrder(Stage.REVIEW, Stage.MASTERED);
        assertThat(counts).filteredOn(c -> c.getStage() == Stage.REVIEW)
                .singleElement()
                .satisfies(c -> assertThat(c.getTotal()).isEqualTo(2));
    }

    @Test
    void secondRowForSameItem_violatesUniqueConstraint() {
        UUID learnerId = UUID.randomUUID();
        SchedulingStateEntity first = save(learnerId, ItemKind.VOCABULARY_CARD, TODAY, Stage.LEARNING, NOW);

        SchedulingStateEntity duplicate = entity(learnerId, ItemKind.VOCABULARY_CARD, first.getItemId(), TODAY, Stage.LEARNING, NOW);

        assertThatThrownBy(() -> stateRepository.saveAndFlush(duplicate))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void reviewLog_countsAndTallies() {
        UUID learnerId = UUID.randomUUID();
        UUID questionA = UUID.randomUUID();
        UUID questionB = UUID.randomUUID();
        logRepository.saveAndFlush(log(learnerId, questionA, 3, Instant.parse("2025-03-10T07:00:00Z")));
        logRepository.saveAndFlush(log(learnerId, questionA, 1, Instant.parse("2025-03-09T07:00:00Z")));
        logRepository.saveAndFlush(log(learnerId, questionB, 5, Instant.parse("2025-03-08T07:00:00Z")));
        ReviewLogEntity card = log(learnerId, UUID.randomUUID(), 4, Instant.parse("2025-03-10T09:00:00Z"));
        card.setItemKind(ItemKind.VOCABULARY_CARD);
        logRepository.saveAndFlush(card);

        assertThat(logRepository.countAnsweredBetween(learnerId, ItemKind.CULTURE_QUESTION,
                Instant.parse("2025-03-10T00:00:00Z"), Instant.parse("2025-03-11T00:00:00Z"))).isEqualTo(1);
        assertThat(logRepository.countAnsweredBetween(learnerId, ItemKind.VOCABULARY_CARD,
                Instant.parse("2025-03-10T00:00:00Z"), Instant.parse("2025-03-11T00:00:00Z"))).isEqualTo(1);
        assertThat(logRepository.findAnsweredAtSince(learnerId, Instant.parse("2025-03-09T00:00:00Z"))).hasSize(3);

        var tally = logRepository.tallyAnswers(learnerId, ItemKind.CULTURE_QUESTION, List.of(questionA, questionB));
        assertThat(tally.getTotal()).isEqualTo(3);
        assertThat(tally.getCorrect()).isEqualTo(2);
    }

    private SchedulingStateEntity save(UUID learnerId, ItemKind kind, LocalDate next, Stage stage, Instant createdAt) {
        return stateRepository.saveAndFlush(entity(learnerId, kind, UUID.randomUUID(), next, stage, createdAt));
    }

    private static SchedulingStateEntity entity(UUID learnerId, ItemKind kind, UUID itemId, LocalDate next, Stage stage, Instant createdAt) {
        SchedulingStateEntity e = new SchedulingStateEntity();
        e.setLearnerId(learnerId);
        e.setItemKind(kind);
        e.setItemId(itemId);
        int reps = stage == Stage.NEW ? 0 : 2;
        e.apply(new SchedulingState(2.5, 6, reps, next, true, stage), createdAt);
        return e;
    }

    private static ReviewLogEntity log(UUID learnerId, UUID itemId, int quality, Instant answeredAt) {
        ReviewLogEntity e = new ReviewLogEntity();
        e.setLearnerId(learnerId);
        e.setItemKind(ItemKind.CULTURE_QUESTION);
        e.setItemId(itemId);
        e.setQuality((short) quality);
        e.setResponseTimeSeconds(4.0);
        e.setAnsweredAt(answeredAt);
        e.setStageBefore(Stage.NEW);
        e.setStageAfter(quality >= 3 ? Stage.LEARNING : Stage.NEW);
        e.setEasinessFactorAfter(2.5);
        e.setIntervalDaysAfter(1);
        return e;
    }
}
