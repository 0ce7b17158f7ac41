package app.learngreek.core.review.service;

import app.learngreek.core.review.algorithm.Sm2Calculator;
import app.learngreek.core.review.api.ItemCatalogPort;
import app.learngreek.core.review.api.ItemCatalogPort.CatalogItem;
import app.learngreek.core.review.controller.dto.BulkReviewItemResult;
import app.learngreek.core.review.controller.dto.BulkReviewResponse;
import app.learngreek.core.review.controller.dto.CultureAnswerResponse;
import app.learngreek.core.review.controller.dto.ReviewPreviewResponse;
import app.learngreek.core.review.controller.dto.ReviewResult;
import app.learngreek.core.review.controller.dto.SubmitReviewRequest;
import app.learngreek.core.review.domain.InvalidQualityException;
import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.domain.ItemNotFoundException;
import app.learngreek.core.review.domain.ReviewOutcome;
import app.learngreek.core.review.domain.SchedulingState;
import app.learngreek.core.review.entity.ReviewLogEntity;
import app.learngreek.core.review.entity.SchedulingStateEntity;
import app.learngreek.core.review.repository.ReviewLogRepository;
import app.learngreek.core.review.repository.SchedulingStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    static final double MAX_RESPONSE_TIME_SECONDS = 180.0;
    static final int CULTURE_OPTION_COUNT = 4;
    static final int CULTURE_CORRECT_QUALITY = 3;
    static final int CULTURE_WRONG_QUALITY = 1;

    private final SchedulingStateRepository stateRepository;
    private final ReviewLogRepository logRepository;
    private final ItemCatalogPort catalogPort;
    private final Sm2Calculator calculator;
    private final Clock clock;

    public ReviewService(SchedulingStateRepository stateRepository,
                         ReviewLogRepository logRepository,
                         ItemCatalogPort catalogPort,
                         Sm2Calculator calculator,
                         Clock clock) {
        this.stateRepository = stateRepository;
        this.logRepository = logRepository;
        this.catalogPort = catalogPort;
        this.calculator = calculator;
        this.clock = clock;
    }

    @Transactional
    public ReviewResult submit(UUID learnerId, ItemKind kind, UUID itemId, int quality, Double responseTimeSeconds) {
        return doSubmit(learnerId, kind, itemId, outcome(quality, responseTimeSeconds));
    }

    @Transactional
    public ReviewResult submit(UUID learnerId, ItemKind kind, UUID itemId, ReviewOutcome outcome) {
        return doSubmit(learnerId, kind, itemId, outcome);
    }

    /**
     * Applies every review in order. An invalid quality or an unknown item fails that entry only;
     * database errors still abort the whole batch.
     */
    @Transactional
    public BulkReviewResponse submitBulk(UUID learnerId, UUID sessionId, List<SubmitReviewRequest> reviews) {
        List<BulkReviewItemResult> results = new ArrayList<>(reviews.size());
        int ok = 0;

        for (SubmitReviewRequest r : reviews) {
            try {
                ReviewOutcome outcome = outcome(r.quality(), r.responseTimeSeconds());
                results.add(BulkReviewItemResult.ok(doSubmit(learnerId, r.itemKind(), r.itemId(), outcome)));
                ok++;
            } catch (InvalidQualityException | ItemNotFoundException ex) {
                log.warn("Bulk review item rejected: learner={} session={} item={} reason={}",
                        learnerId, sessionId, r.itemId(), ex.getMessage());
                results.add(BulkReviewItemResult.failed(r.itemId(), r.itemKind(), ex.getMessage()));
            }
        }

        log.info("Bulk review processed: learner={} session={} total={} ok={} failed={}",
                learnerId, sessionId, reviews.size(), ok, reviews.size() - ok);
        return new BulkReviewResponse(sessionId, reviews.size(), ok, reviews.size() - ok, results);
    }

    /**
     * Multiple-choice answer. Correct maps to quality 3, wrong to quality 1.
     */
    @Transactional
    public CultureAnswerResponse answerCultureQuestion(UUID learnerId,
                                                       UUID questionId,
                                                       Integer selectedOption,
                                                       Double responseTimeSeconds) {
        if (selectedOption == null || selectedOption < 1 || selectedOption > CULTURE_OPTION_COUNT) {
            throw new IllegalArgumentException("selectedOption must be between 1 and " + CULTURE_OPTION_COUNT);
        }

        int correctOption = catalogPort.findCorrectOption(questionId)
                .orElseThrow(() -> new ItemNotFoundException(ItemKind.CULTURE_QUESTION, questionId));
        boolean correct = selectedOption == correctOption;
        int quality = correct ? CULTURE_CORRECT_QUALITY : CULTURE_WRONG_QUALITY;

        ReviewResult result = doSubmit(learnerId, ItemKind.CULTURE_QUESTION, questionId,
                outcome(quality, responseTimeSeconds));
        return new CultureAnswerResponse(correct, correctOption, result);
    }

    @Transactional(readOnly = true)
    public ReviewPreviewResponse preview(UUID learnerId, ItemKind kind, UUID itemId) {
        requireItem(kind, itemId);
        SchedulingState state = stateRepository.findByLearnerIdAndItemKindAndItemId(learnerId, kind, itemId)
                .map(SchedulingStateEntity::toState)
                .orElseGet(calculator::initialState);
        LocalDate today = LocalDate.now(clock);
        return new ReviewPreviewResponse(itemId, kind, state.stage(),
                calculator.previewNextReviewDates(state, today));
    }

    private ReviewResult doSubmit(UUID learnerId, ItemKind kind, UUID itemId, ReviewOutcome outcome) {
        ReviewOutcome.requireValidQuality(outcome.quality());
        CatalogItem item = requireItem(kind, itemId);

        Instant now = clock.instant();
        LocalDate answeredOn = LocalDate.ofInstant(outcome.answeredAt(), clock.getZone());

        SchedulingStateEntity entity = stateRepository.findForUpdate(learnerId, kind, itemId)
                .orElseGet(() -> newState(learnerId, item, now));

        SchedulingState before = entity.toState();
        SchedulingState after = calculator.calculateNextState(before, outcome.quality(), answeredOn);
        entity.apply(after, now);
        stateRepository.save(entity);

        logRepository.save(logEntry(learnerId, kind, itemId, outcome, before, after));

        log.debug("Review learner={} item={}:{} q={} stage {} -> {} ef={} interval={} next={}",
                learnerId, kind, itemId, outcome.quality(), before.stage(), after.stage(),
                after.easinessFactor(), after.intervalDays(), after.nextReviewDate());

        return new ReviewResult(
                itemId,
                kind,
                outcome.quality(),
                before.stage(),
                after.stage(),
                after.easinessFactor(),
                after.intervalDays(),
                after.repetitions(),
                after.nextReviewDate()
        );
    }

    private CatalogItem requireItem(ItemKind kind, UUID itemId) {
        return catalogPort.findItem(kind, itemId)
                .orElseThrow(() -> new ItemNotFoundException(kind, itemId));
    }

    private SchedulingStateEntity newState(UUID learnerId, CatalogItem item, Instant now) {
        SchedulingStateEntity e = new SchedulingStateEntity();
        e.setLearnerId(learnerId);
        e.setItemKind(item.kind());
        e.setItemId(item.itemId());
        e.setDeckId(item.deckId());
        e.apply(calculator.initialState(), now);
        return e;
    }

    private ReviewOutcome outcome(int quality, Double responseTimeSeconds) {
        double rt = responseTimeSeconds == null ? 0.0 : responseTimeSeconds;
        rt = Math.max(0.0, Math.min(MAX_RESPONSE_TIME_SECONDS, rt));
        return new ReviewOutcome(quality, rt, clock.instant());
    }

    private static ReviewLogEntity logEntry(UUID learnerId,
                                            ItemKind kind,
                                            UUID itemId,
                                            ReviewOutcome outcome,
                                            SchedulingState before,
                                            SchedulingState after) {
        ReviewLogEntity e = new ReviewLogEntity();
        e.setLearnerId(learnerId);
        e.setItemKind(kind);
        e.setItemId(itemId);
        e.setQuality((short) outcome.quality());
        e.setResponseTimeSeconds(outcome.responseTimeSeconds());
        e.setAnsweredAt(outcome.answeredAt());
        e.setStageBefore(before.stage());
        e.setStageAfter(after.stage());
        e.setEasinessFactorAfter(after.easinessFactor());
        e.setIntervalDaysAfter(after.intervalDays());
        return e;
    }
}
