package app.learngreek.core.review.controller;

import app.learngreek.core.review.domain.DeckNotFoundException;
import app.learngreek.core.review.domain.InvalidQualityException;
import app.learngreek.core.review.domain.ItemNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps scheduling errors to problem responses. Bean-validation and binding failures are
 * handled by the {@link ResponseEntityExceptionHandler} defaults (400).
 */
@RestControllerAdvice
public class ReviewExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ReviewExceptionHandler.class);

    @ExceptionHandler(InvalidQualityException.class)
    public ResponseEntity<ProblemDetail> handleInvalidQuality(InvalidQualityException ex) {
        ProblemDetail problem = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid Quality", ex.getMessage());
        problem.setProperty("quality", ex.getQuality());
        return ResponseEntity.unprocessableEntity().body(problem);
    }

    @ExceptionHandler(ItemNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(ItemNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(problem(HttpStatus.NOT_FOUND, "Item Not Found", ex.getMessage()));
    }

    @ExceptionHandler(DeckNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleDeckNotFound(DeckNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(problem(HttpStatus.NOT_FOUND, "Deck Not Found", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest()
                .body(problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage()));
    }

    // two concurrent first reviews of one item, or a stale row version
    @ExceptionHandler({DataIntegrityViolationException.class, OptimisticLockingFailureException.class})
    public ResponseEntity<ProblemDetail> handleConflict(RuntimeException ex) {
        log.warn("Concurrent review update rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(problem(HttpStatus.CONFLICT, "Conflict", "The item was updated concurrently, resubmit the review"));
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return problem;
    }
}
