package app.learngreek.core.review.service;

import app.learngreek.core.review.algorithm.StreakCalculator;
import app.learngreek.core.review.api.ItemCatalogPort;
import app.learngreek.core.review.controller.dto.StudyStatsResponse;
import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.domain.Stage;
import app.learngreek.core.review.repository.ReviewLogRepository;
import app.learngreek.core.review.repository.SchedulingStateRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
public class StudyStatsService {

    static final int STREAK_LOOKBACK_DAYS = 365;

    private final SchedulingStateRepository stateRepository;
    private final ReviewLogRepository logRepository;
    private final ItemCatalogPort catalogPort;
    private final StreakCalculator streakCalculator;
    private final Clock clock;

    public StudyStatsService(SchedulingStateRepository stateRepository,
                             ReviewLogRepository logRepository,
                             ItemCatalogPort catalogPort,
                             StreakCalculator streakCalculator,
                             Clock clock) {
        this.stateRepository = stateRepository;
        this.logRepository = logRepository;
        this.catalogPort = catalogPort;
        this.streakCalculator = streakCalculator;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public StudyStatsResponse stats(UUID learnerId, ItemKind kind) {
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);

        Map<Stage, Long> counts = new EnumMap<>(Stage.class);
        for (Stage s : Stage.values()) {
            if (s != Stage.UNKNOWN) {
                counts.put(s, 0L);
            }
        }
        long tracked = 0;
        for (var row : stateRepository.countByStage(learnerId, kind)) {
            counts.merge(row.getStage(), row.getTotal(), Long::sum);
            tracked += row.getTotal();
        }
        long unseen = Math.max(0, catalogPort.countItems(kind) - tracked);
        counts.merge(Stage.NEW, unseen, Long::sum);

        Map<String, Long> byStage = new LinkedHashMap<>();
        counts.forEach((stage, n) -> byStage.put(stage.value(), n));

        long dueToday = stateRepository.countDue(learnerId, kind, today);

        Instant dayStart = today.atStartOfDay(zone).toInstant();
        Instant dayEnd = today.plusDays(1).atStartOfDay(zone).toInstant();
        long reviewsToday = logRepository.countAnsweredBetween(learnerId, kind, dayStart, dayEnd);

        // any kind of study keeps the streak alive
        Instant lookback = today.minusDays(STREAK_LOOKBACK_DAYS).atStartOfDay(zone).toInstant();
        Set<LocalDate> studyDays = logRepository.findAnsweredAtSince(learnerId, lookback).stream()
                .map(at -> LocalDate.ofInstant(at, zone))
                .collect(Collectors.toSet());
        int streak = streakCalculator.currentStreak(studyDays, today);

        return new StudyStatsResponse(kind, byStage, dueToday, reviewsToday, streak);
    }
}
