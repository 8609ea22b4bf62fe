package uk.gegc.adaptive.features.generation.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.adaptive.features.generation.application.QuizGenerationService;
import uk.gegc.adaptive.features.generation.application.dto.CategoryBreakdownDto;
import uk.gegc.adaptive.features.generation.application.dto.GenerateQuizCommand;
import uk.gegc.adaptive.features.generation.application.dto.GeneratedQuizDto;
import uk.gegc.adaptive.features.session.application.dto.SessionQuestionDto;
import uk.gegc.adaptive.features.session.domain.model.SessionStatus;
import uk.gegc.adaptive.features.session.domain.model.SessionType;
import uk.gegc.adaptive.shared.api.ApiHeaders;
import uk.gegc.adaptive.shared.api.problem.ErrorTypes;
import uk.gegc.adaptive.shared.exception.NoCategoriesAvailableException;
import uk.gegc.adaptive.shared.exception.NoEligibleQuestionsException;

import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.hasItem;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdaptiveQuizController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("AdaptiveQuizController")
class AdaptiveQuizControllerTest {

    private static final String LEARNER_ID = "10000000-0000-0000-0000-000000000001";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private QuizGenerationService quizGenerationService;

    @Test
    @DisplayName("POST /api/v1/adaptive-quizzes returns 201 with the generated session")
    void generate_returnsCreated() throws Exception {
        UUID sessionId = UUID.randomUUID();
        UUID categoryId = UUID.randomUUID();
        UUID questionId = UUID.randomUUID();
        GeneratedQuizDto quiz = new GeneratedQuizDto(
                sessionId, SessionType.TIMED, SessionStatus.ACTIVE, 1480, 1,
                List.of(new SessionQuestionDto(0, questionId, "What is a B-tree?", List.of("a", "b"), "a", null,
                        categoryId, "Databases", 1470)),
                List.of(new CategoryBreakdownDto(categoryId, "Databases", 3.0, 1, 1))
        );
        when(quizGenerationService.generateQuiz(any(GenerateQuizCommand.class))).thenReturn(quiz);

        mockMvc.perform(post("/api/v1/adaptive-quizzes")
                        .header(ApiHeaders.LEARNER_ID, LEARNER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"questionCount": 1, "sessionType": "TIMED"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").value(sessionId.toString()))
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.targetRating").value(1480))
                .andExpect(jsonPath("$.questions[0].questionId").value(questionId.toString()))
                .andExpect(jsonPath("$.questions[0].questionRating").value(1470))
                .andExpect(jsonPath("$.breakdown[0].selected").value(1));

        verify(quizGenerationService).generateQuiz(
                new GenerateQuizCommand(UUID.fromString(LEARNER_ID), 1, SessionType.TIMED, null));
    }

    @Test
    @DisplayName("missing learner header returns 400 problem detail")
    void generate_missingHeader_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/adaptive-quizzes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionCount\": 5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value(ErrorTypes.MISSING_HEADER.toString()));

        verifyNoInteractions(quizGenerationService);
    }

    @Test
    @DisplayName("out-of-range question count returns 400 with field errors")
    void generate_invalidCount_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/adaptive-quizzes")
                        .header(ApiHeaders.LEARNER_ID, LEARNER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionCount\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value(ErrorTypes.VALIDATION_FAILED.toString()))
                .andExpect(jsonPath("$.fieldErrors[*].field", hasItem("questionCount")));

        verifyNoInteractions(quizGenerationService);
    }

    @Test
    @DisplayName("learner without categories returns 422")
    void generate_noCategories_returns422() throws Exception {
        when(quizGenerationService.generateQuiz(any(GenerateQuizCommand.class)))
                .thenThrow(new NoCategoriesAvailableException(UUID.fromString(LEARNER_ID)));

        mockMvc.perform(post("/api/v1/adaptive-quizzes")
                        .header(ApiHeaders.LEARNER_ID, LEARNER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionCount\": 5}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.type").value(ErrorTypes.NO_CATEGORIES_AVAILABLE.toString()));
    }

    @Test
    @DisplayName("empty pools return 422")
    void generate_noEligibleQuestions_returns422() throws Exception {
        when(quizGenerationService.generateQuiz(any(GenerateQuizCommand.class)))
                .thenThrow(new NoEligibleQuestionsException(UUID.fromString(LEARNER_ID)));

        mockMvc.perform(post("/api/v1/adaptive-quizzes")
                        .header(ApiHeaders.LEARNER_ID, LEARNER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionCount\": 5}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.type").value(ErrorTypes.NO_ELIGIBLE_QUESTIONS.toString()));
    }

    @Test
    @DisplayName("a duplicate history row from a racing generation returns a retryable 409")
    void generate_concurrentHistoryInsert_returns409() throws Exception {
        when(quizGenerationService.generateQuiz(any(GenerateQuizCommand.class)))
                .thenThrow(new DataIntegrityViolationException("Duplicate entry for key 'uk_question_history_learner_question'"));

        mockMvc.perform(post("/api/v1/adaptive-quizzes")
                        .header(ApiHeaders.LEARNER_ID, LEARNER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionCount\": 5}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.type").value(ErrorTypes.CONCURRENT_UPDATE.toString()))
                .andExpect(jsonPath("$.retryable").value(true));
    }
}
