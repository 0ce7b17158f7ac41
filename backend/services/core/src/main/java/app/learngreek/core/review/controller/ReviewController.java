package app.learngreek.core.review.controller;

import app.learngreek.core.review.controller.dto.BulkReviewRequest;
import app.learngreek.core.review.controller.dto.BulkReviewResponse;
import app.learngreek.core.review.controller.dto.ReviewPreviewResponse;
import app.learngreek.core.review.controller.dto.ReviewResult;
import app.learngreek.core.review.controller.dto.SubmitReviewRequest;
import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.service.ReviewService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/learners/{learnerId}/reviews")
public class ReviewController {

    private final ReviewService reviewService;

    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    // POST /learners/{learnerId}/reviews
    @PostMapping
    public ReviewResult submit(@PathVariable UUID learnerId,
                               @Valid @RequestBody SubmitReviewRequest req) {
        return reviewService.submit(learnerId, req.itemKind(), req.itemId(), req.quality(), req.responseTimeSeconds());
    }

    // POST /learners/{learnerId}/reviews/bulk
    @PostMapping("/bulk")
    public BulkReviewResponse submitBulk(@PathVariable UUID learnerId,
                                         @Valid @RequestBody BulkReviewRequest req) {
        return reviewService.submitBulk(learnerId, req.sessionId(), req.reviews());
    }

    // GET /learners/{learnerId}/reviews/preview?kind=VOCABULARY_CARD&itemId=...
    @GetMapping("/preview")
    public ReviewPreviewResponse preview(@PathVariable UUID learnerId,
                                         @RequestParam ItemKind kind,
                                         @RequestParam UUID itemId) {
        return reviewService.preview(learnerId, kind, itemId);
    }
}
