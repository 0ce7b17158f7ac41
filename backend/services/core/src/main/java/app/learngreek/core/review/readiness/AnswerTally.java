package app.learngreek.core.review.readiness;

/**
 * Answer counts over the included categories, as recorded in the review log.
 */
public record AnswerTally(long totalAnswers, long correctAnswers) {

    public static final AnswerTally NONE = new AnswerTally(0, 0);
}
