package app.learngreek.core.review.controller;

import app.learngreek.core.review.controller.dto.CultureAnswerResponse;
import app.learngreek.core.review.controller.dto.ReviewResult;
import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.domain.ReadinessVerdict;
import app.learngreek.core.review.domain.Stage;
import app.learngreek.core.review.readiness.CategoryReadiness;
import app.learngreek.core.review.readiness.ReadinessResult;
import app.learngreek.core.review.service.ReadinessService;
import app.learngreek.core.review.service.ReviewService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CultureController.class)
@ActiveProfiles("test")
class CultureControllerWebMvcTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    ReviewService reviewService;

    @MockitoBean
    ReadinessService readinessService;

    private final UUID learnerId = UUID.randomUUID();
    private final UUID questionId = UUID.randomUUID();

    @Test
    void answer_returnsCorrectnessAndSchedule() throws Exception {
        ReviewResult result = new ReviewResult(questionId, ItemKind.CULTURE_QUESTION, 3, Stage.NEW, Stage.LEARNING,
                2.36, 1, 1, LocalDate.of(2025, 1, 2));
        when(reviewService.answerCultureQuestion(learnerId, questionId, 2, 8.5))
                .thenReturn(new CultureAnswerResponse(true, 2, result));

        mockMvc.perform(post("/learners/{learnerId}/culture/questions/{questionId}/answer", learnerId, questionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"selectedOption\":2,\"responseTimeSeconds\":8.5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.correct").value(true))
                .andExpect(jsonPath("$.result.quality").value(3))
                .andExpect(jsonPath("$.result.stage").value("learning"));
    }

    @Test
    void answer_optionOutOfRange_returns400() throws Exception {
        when(reviewService.answerCultureQuestion(eq(learnerId), eq(questionId), eq(7), any()))
                .thenThrow(new IllegalArgumentException("selectedOption must be between 1 and 4"));

        mockMvc.perform(post("/learners/{learnerId}/culture/questions/{questionId}/answer", learnerId, questionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"selectedOption\":7}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("selectedOption must be between 1 and 4"));
    }

    @Test
    void readiness_serializesVerdictWireValue() throws Exception {
        when(readinessService.readiness(learnerId, List.of("history", "politics"))).thenReturn(new ReadinessResult(
                60.0, ReadinessVerdict.READY, 4, 10, null, 0, List.of(
                        new CategoryReadiness("politics", 25.0, 0, 4),
                        new CategoryReadiness("history", 87.5, 4, 6))));

        mockMvc.perform(get("/learners/{learnerId}/culture/readiness", learnerId)
                        .param("categories", "history,politics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.readinessPercentage").value(60.0))
                .andExpect(jsonPath("$.verdict").value("ready"))
                .andExpect(jsonPath("$.categories[0].category").value("politics"));
    }
}
