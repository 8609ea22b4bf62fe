package uk.gegc.adaptive.integration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.adaptive.BaseIntegrationTest;
import uk.gegc.adaptive.features.category.domain.model.Category;
import uk.gegc.adaptive.features.category.domain.repository.CategoryRepository;
import uk.gegc.adaptive.features.generation.application.QuizGenerationService;
import uk.gegc.adaptive.features.generation.application.dto.GenerateQuizCommand;
import uk.gegc.adaptive.features.generation.application.dto.GeneratedQuizDto;
import uk.gegc.adaptive.features.learner.application.LearnerRatingProvisioner;
import uk.gegc.adaptive.features.learner.domain.model.LearnerRating;
import uk.gegc.adaptive.features.learner.domain.repository.LearnerRatingRepository;
import uk.gegc.adaptive.features.question.domain.model.Question;
import uk.gegc.adaptive.features.question.domain.repository.QuestionRepository;
import uk.gegc.adaptive.features.session.application.dto.SessionQuestionDto;
import uk.gegc.adaptive.features.session.domain.model.SessionType;
import uk.gegc.adaptive.features.settlement.application.SessionSettlementService;
import uk.gegc.adaptive.features.settlement.application.dto.AttemptSubmission;
import uk.gegc.adaptive.features.settlement.application.dto.SettlementCommand;
import uk.gegc.adaptive.features.settlement.application.dto.SettlementResultDto;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Runs outside the test transaction so that both settlements commit and contend for the learner row.
 * Committed rows are deleted after each test.
 */
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("Concurrent settlement integration tests")
class SettlementConcurrencyIntegrationTest extends BaseIntegrationTest {

    @Autowired private CategoryRepository categoryRepository;
    @Autowired private QuestionRepository questionRepository;
    @Autowired private LearnerRatingRepository learnerRatingRepository;
    @Autowired private LearnerRatingProvisioner learnerRatingProvisioner;
    @Autowired private QuizGenerationService quizGenerationService;
    @Autowired private SessionSettlementService settlementService;
    @Autowired private PlatformTransactionManager transactionManager;

    private UUID learnerId;
    private Category category;

    @BeforeEach
    void seed() {
        learnerId = UUID.randomUUID();
        category = categoryRepository.save(new Category(null, "Networking " + UUID.randomUUID(), null));
        for (int i = 0; i < 15; i++) {
            Question question = new Question();
            question.setQuestionText("Networking question " + i);
            question.setOptions("[\"a\",\"b\"]");
            question.setCorrectAnswer("a");
            question.setRating(1450 + i * 7);
            question.getCategories().add(category);
            questionRepository.save(question);
        }
        learnerRatingProvisioner.ensureExists(learnerId);
    }

    @AfterEach
    void cleanUp() {
        new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            for (String entity : List.of("QuestionAttempt", "QuestionHistoryEntry", "CategoryMicroRating",
                    "CategoryPracticePriority", "LearnerRating")) {
                entityManager.createQuery("DELETE FROM " + entity + " e WHERE e.learnerId = :learnerId")
                        .setParameter("learnerId", learnerId)
                        .executeUpdate();
            }
            entityManager.createQuery("""
                            DELETE FROM SessionQuestion sq
                            WHERE sq.session.id IN (SELECT s.id FROM QuizSession s WHERE s.learnerId = :learnerId)
                            """)
                    .setParameter("learnerId", learnerId)
                    .executeUpdate();
            entityManager.createQuery("DELETE FROM QuizSession s WHERE s.learnerId = :learnerId")
                    .setParameter("learnerId", learnerId)
                    .executeUpdate();
            // entity removal also clears the question_categories join rows
            List<Question> questions = entityManager.createQuery(
                            "SELECT q FROM Question q JOIN q.categories c WHERE c.id = :categoryId", Question.class)
                    .setParameter("categoryId", category.getId())
                    .getResultList();
            questionRepository.deleteAll(questions);
            categoryRepository.deleteById(category.getId());
        });
    }

    @Test
    @DisplayName("two sessions settled at once are applied one after the other")
    void concurrentSettlements_areSerialized() throws Exception {
        GeneratedQuizDto first = quizGenerationService.generateQuiz(
                new GenerateQuizCommand(learnerId, 5, SessionType.PRACTICE, List.of(category.getId())));
        GeneratedQuizDto second = quizGenerationService.generateQuiz(
                new GenerateQuizCommand(learnerId, 5, SessionType.PRACTICE, List.of(category.getId())));

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<SettlementResultDto> a = executor.submit(settle(first, true, start));
            Future<SettlementResultDto> b = executor.submit(settle(second, false, start));
            start.countDown();

            SettlementResultDto resultA = a.get(30, TimeUnit.SECONDS);
            SettlementResultDto resultB = b.get(30, TimeUnit.SECONDS);
            SettlementResultDto earlier = resultA.ratingBefore() == 1500 ? resultA : resultB;
            SettlementResultDto later = earlier == resultA ? resultB : resultA;

            assertEquals(1500, earlier.ratingBefore());
            assertEquals(earlier.ratingAfter(), later.ratingBefore());

            LearnerRating learner = learnerRatingRepository.findByLearnerId(learnerId).orElseThrow();
            assertEquals(10, learner.getGamesPlayed());
            assertEquals(later.ratingAfter(), learner.getRating());
        } finally {
            executor.shutdownNow();
        }
    }

    private Callable<SettlementResultDto> settle(GeneratedQuizDto quiz, boolean correct, CountDownLatch start) {
        List<AttemptSubmission> attempts = quiz.questions().stream()
                .map(SessionQuestionDto::questionId)
                .map(id -> new AttemptSubmission(id, correct ? "a" : "b", correct, 12))
                .toList();
        return () -> {
            start.await();
            return settlementService.completeSession(new SettlementCommand(quiz.sessionId(), learnerId, attempts));
        };
    }
}
