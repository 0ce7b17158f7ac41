package app.learngreek.core.review.service;

import app.learngreek.core.review.algorithm.SchedulingConfig;
import app.learngreek.core.review.api.ItemCatalogPort;
import app.learngreek.core.review.controller.dto.StudyQueueResponse;
import app.learngreek.core.review.domain.DeckNotFoundException;
import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.domain.Stage;
import app.learngreek.core.review.entity.SchedulingStateEntity;
import app.learngreek.core.review.queue.ItemCandidate;
import app.learngreek.core.review.queue.ItemState;
import app.learngreek.core.review.queue.QueueEntry;
import app.learngreek.core.review.queue.QueueLimits;
import app.learngreek.core.review.queue.StudyQueueBuilder;
import app.learngreek.core.review.repository.SchedulingStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

@Service
public class StudyQueueService {

    private static final Logger log = LoggerFactory.getLogger(StudyQueueService.class);

    private static final List<Stage> EARLY_PRACTICE_STAGES = List.of(Stage.LEARNING, Stage.REVIEW);

    private final SchedulingStateRepository stateRepository;
    private final ItemCatalogPort catalogPort;
    private final StudyQueueBuilder queueBuilder;
    private final SchedulingConfig config;
    private final Clock clock;

    public StudyQueueService(SchedulingStateRepository stateRepository,
                             ItemCatalogPort catalogPort,
                             StudyQueueBuilder queueBuilder,
                             SchedulingConfig config,
                             Clock clock) {
        this.stateRepository = stateRepository;
        this.catalogPort = catalogPort;
        this.queueBuilder = queueBuilder;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Fills unset caps from configuration. Early practice stays off unless asked for.
     */
    public QueueLimits limits(Integer maxDue, Integer maxNew, Boolean includeEarlyPractice, Integer maxEarlyPractice) {
        return new QueueLimits(
                maxDue == null ? config.defaultMaxDue() : maxDue,
                maxNew == null ? config.defaultMaxNew() : maxNew,
                Boolean.TRUE.equals(includeEarlyPractice),
                maxEarlyPractice == null ? config.defaultMaxEarlyPractice() : maxEarlyPractice
        );
    }

    @Transactional(readOnly = true)
    public StudyQueueResponse queue(UUID learnerId, ItemKind kind, UUID deckId, QueueLimits limits) {
        if (deckId != null && !catalogPort.isActiveDeck(kind, deckId)) {
            throw new DeckNotFoundException(kind, deckId);
        }
        LocalDate today = LocalDate.now(clock);

        List<ItemState> due = limits.maxDue() == 0
                ? List.of()
                : toItemStates(deckId == null
                        ? stateRepository.findDue(learnerId, kind, today, PageRequest.of(0, limits.maxDue()))
                        : stateRepository.findDueInDeck(learnerId, kind, deckId, today, PageRequest.of(0, limits.maxDue())));

        List<ItemCandidate> fresh = catalogPort.findNewItems(learnerId, kind, deckId, limits.maxNew()).stream()
                .map(i -> new ItemCandidate(i.itemId(), i.kind(), i.orderIndex()))
                .toList();

        List<ItemState> early = List.of();
        if (limits.includeEarlyPractice() && limits.maxEarlyPractice() > 0) {
            PageRequest page = PageRequest.of(0, limits.maxEarlyPractice());
            early = toItemStates(deckId == null
                    ? stateRepository.findUpcoming(learnerId, kind, today, EARLY_PRACTICE_STAGES, page)
                    : stateRepository.findUpcomingInDeck(learnerId, kind, deckId, today, EARLY_PRACTICE_STAGES, page));
        }

        List<QueueEntry> entries = queueBuilder.build(due, fresh, early, limits, today);

        int newCount = (int) entries.stream().filter(QueueEntry::isNew).count();
        int earlyCount = (int) entries.stream().filter(QueueEntry::earlyPractice).count();
        int dueCount = entries.size() - newCount - earlyCount;

        log.debug("Study queue learner={} kind={} deck={} due={} new={} early={}",
                learnerId, kind, deckId, dueCount, newCount, earlyCount);

        return new StudyQueueResponse(kind, dueCount, newCount, earlyCount, entries.size(), entries);
    }

    private static List<ItemState> toItemStates(List<SchedulingStateEntity> rows) {
        return rows.stream()
                .map(r -> new ItemState(r.getItemId(), r.getItemKind(), r.toState(), creationOrder(r.getCreatedAt())))
                .toList();
    }

    private static long creationOrder(Instant createdAt) {
        return createdAt == null ? Long.MAX_VALUE : ChronoUnit.MICROS.between(Instant.EPOCH, createdAt);
    }
}
