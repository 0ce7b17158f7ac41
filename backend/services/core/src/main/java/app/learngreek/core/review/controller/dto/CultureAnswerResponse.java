package app.learngreek.core.review.controller.dto;

public record CultureAnswerResponse(
        boolean correct,
        int correctOption,
        ReviewResult result
) {
}
