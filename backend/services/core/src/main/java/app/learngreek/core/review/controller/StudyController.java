package app.learngreek.core.review.controller;

import app.learngreek.core.review.controller.dto.StudyQueueResponse;
import app.learngreek.core.review.controller.dto.StudyStatsResponse;
import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.queue.QueueLimits;
import app.learngreek.core.review.service.StudyQueueService;
import app.learngreek.core.review.service.StudyStatsService;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/learners/{learnerId}/study")
public class StudyController {

    private final StudyQueueService queueService;
    private final StudyStatsService statsService;

    public StudyController(StudyQueueService queueService, StudyStatsService statsService) {
        this.queueService = queueService;
        this.statsService = statsService;
    }

    // GET /learners/{learnerId}/study/queue?kind=VOCABULARY_CARD&maxDue=20&maxNew=10
    @GetMapping("/queue")
    public StudyQueueResponse queue(@PathVariable UUID learnerId,
                                    @RequestParam(defaultValue = "VOCABULARY_CARD") ItemKind kind,
                                    @RequestParam(required = false) UUID deckId,
                                    @RequestParam(required = false) Integer maxDue,
                                    @RequestParam(required = false) Integer maxNew,
                                    @RequestParam(required = false) Boolean includeEarlyPractice,
                                    @RequestParam(required = false) Integer maxEarlyPractice) {
        QueueLimits limits = queueService.limits(maxDue, maxNew, includeEarlyPractice, maxEarlyPractice);
        return queueService.queue(learnerId, kind, deckId, limits);
    }

    // GET /learners/{learnerId}/study/stats?kind=CULTURE_QUESTION
    @GetMapping("/stats")
    public StudyStatsResponse stats(@PathVariable UUID learnerId,
                                    @RequestParam(defaultValue = "VOCABULARY_CARD") ItemKind kind) {
        return statsService.stats(learnerId, kind);
    }
}
