package app.learngreek.core.review.service;

import app.learngreek.core.review.algorithm.StreakCalculator;
import app.learngreek.core.review.api.ItemCatalogPort;
import app.learngreek.core.review.controller.dto.StudyStatsResponse;
import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.domain.Stage;
import app.learngreek.core.review.repository.ReviewLogRepository;
import app.learngreek.core.review.repository.SchedulingStateRepository;
import app.learngreek.core.review.repository.SchedulingStateRepository.StageCountProjection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StudyStatsServiceTest {

    // 2025-04-10 01:30 in Athens, still 2025-04-09 in UTC
    private static final Instant NOW = Instant.parse("2025-04-09T22:30:00Z");
    private static final ZoneId ATHENS = ZoneId.of("Europe/Athens");

    @Mock
    SchedulingStateRepository stateRepository;

    @Mock
    ReviewLogRepository logRepository;

    @Mock
    ItemCatalogPort catalogPort;

    StudyStatsService service;

    private final UUID learnerId = UUID.randomUUID();

    @BeforeEach
    void setup() {
        service = new StudyStatsService(
                stateRepository,
                logRepository,
                catalogPort,
                new StreakCalculator(),
                Clock.fixed(NOW, ATHENS)
        );
    }

    @Test
    void stats_countsStagesDueAndStreakInLearnerZone() {
        LocalDate today = LocalDate.of(2025, 4, 10);
        when(stateRepository.countByStage(learnerId, ItemKind.VOCABULARY_CARD)).thenReturn(List.of(
                count(Stage.NEW, 2),
                count(Stage.LEARNING, 5),
                count(Stage.MASTERED, 1)
        ));
        when(catalogPort.countItems(ItemKind.VOCABULARY_CARD)).thenReturn(20L);
        when(stateRepository.countDue(learnerId, ItemKind.VOCABULARY_CARD, today)).thenReturn(4L);
        when(logRepository.countAnsweredBetween(learnerId, ItemKind.VOCABULARY_CARD,
                Instant.parse("2025-04-09T21:00:00Z"), Instant.parse("2025-04-10T21:00:00Z"))).thenReturn(7L);
        when(logRepository.findAnsweredAtSince(eq(learnerId), any())).thenReturn(List.of(
                Instant.parse("2025-04-09T22:00:00Z"),
                Instant.parse("2025-04-09T08:00:00Z"),
                Instant.parse("2025-04-08T12:00:00Z"),
                Instant.parse("2025-04-05T12:00:00Z")
        ));

        StudyStatsResponse stats = service.stats(learnerId, ItemKind.VOCABULARY_CARD);

        assertThat(stats.byStage()).containsExactly(
                entry("new", 14L),
                entry("learning", 5L),
                entry("review", 0L),
                entry("relearning", 0L),
                entry("mastered", 1L)
        );
        assertThat(stats.dueToday()).isEqualTo(4);
        assertThat(stats.reviewsToday()).isEqualTo(7);
        assertThat(stats.currentStreak()).isEqualTo(3);
    }

    private static StageCountProjection count(Stage stage, long total) {
        return new StageCountProjection() {
            @Override
            public Stage getStage() {
                return stage;
            }

            @Override
            public long getTotal() {
                return total;
            }
        };
    }
}
