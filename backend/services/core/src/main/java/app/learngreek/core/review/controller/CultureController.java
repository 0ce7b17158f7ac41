package app.learngreek.core.review.controller;

import app.learngreek.core.review.controller.dto.CultureAnswerRequest;
import app.learngreek.core.review.controller.dto.CultureAnswerResponse;
import app.learngreek.core.review.readiness.ReadinessResult;
import app.learngreek.core.review.service.ReadinessService;
import app.learngreek.core.review.service.ReviewService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/learners/{learnerId}/culture")
public class CultureController {

    private final ReviewService reviewService;
    private final ReadinessService readinessService;

    public CultureController(ReviewService reviewService, ReadinessService readinessService) {
        this.reviewService = reviewService;
        this.readinessService = readinessService;
    }

    // POST /learners/{learnerId}/culture/questions/{questionId}/answer
    @PostMapping("/questions/{questionId}/answer")
    public CultureAnswerResponse answer(@PathVariable UUID learnerId,
                                        @PathVariable UUID questionId,
                                        @Valid @RequestBody CultureAnswerRequest req) {
        return reviewService.answerCultureQuestion(learnerId, questionId, req.selectedOption(), req.responseTimeSeconds());
    }

    // GET /learners/{learnerId}/culture/readiness?categories=history,politics
    @GetMapping("/readiness")
    public ReadinessResult readiness(@PathVariable UUID learnerId,
                                     @RequestParam(required = false) List<String> categories) {
        return readinessService.readiness(learnerId, categories);
    }
}
