package uk.gegc.adaptive.features.settlement.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.adaptive.features.category.domain.model.Category;
import uk.gegc.adaptive.features.categoryrating.domain.model.CategoryMicroRating;
import uk.gegc.adaptive.features.categoryrating.domain.model.PerformanceTrend;
import uk.gegc.adaptive.features.categoryrating.domain.repository.CategoryMicroRatingRepository;
import uk.gegc.adaptive.features.history.domain.model.QuestionHistoryEntry;
import uk.gegc.adaptive.features.history.domain.repository.QuestionHistoryRepository;
import uk.gegc.adaptive.features.learner.application.LearnerRatingProvisioner;
import uk.gegc.adaptive.features.learner.domain.model.LearnerRating;
import uk.gegc.adaptive.features.learner.domain.repository.LearnerRatingRepository;
import uk.gegc.adaptive.features.priority.application.CategoryPriorityService;
import uk.gegc.adaptive.features.priority.application.PriorityWeightCalculator;
import uk.gegc.adaptive.features.question.domain.model.Question;
import uk.gegc.adaptive.features.question.domain.repository.QuestionRepository;
import uk.gegc.adaptive.features.rating.application.RatingCalculator;
import uk.gegc.adaptive.features.rating.config.RatingProperties;
import uk.gegc.adaptive.features.session.domain.model.*;
import uk.gegc.adaptive.features.session.domain.repository.QuestionAttemptRepository;
import uk.gegc.adaptive.features.session.domain.repository.QuizSessionRepository;
import uk.gegc.adaptive.features.session.domain.repository.SessionQuestionRepository;
import uk.gegc.adaptive.features.settlement.application.SessionSettlementService;
import uk.gegc.adaptive.features.settlement.application.SessionStatsCalculator;
import uk.gegc.adaptive.features.settlement.application.dto.*;
import uk.gegc.adaptive.shared.exception.ResourceNotFoundException;
import uk.gegc.adaptive.shared.exception.SessionStateException;
import uk.gegc.adaptive.shared.exception.SettlementFailedException;
import uk.gegc.adaptive.shared.exception.ValidationException;
import uk.gegc.adaptive.shared.metrics.EngineMetricsService;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class SessionSettlementServiceImpl implements SessionSettlementService {

    private static final int RECENT_ACCURACY_WINDOW = 10;
    private static final double TREND_THRESHOLD = 0.10;

    private final TransactionTemplate transactionTemplate;
    private final LearnerRatingProvisioner learnerRatingProvisioner;
    private final LearnerRatingRepository learnerRatingRepository;
    private final QuizSessionRepository sessionRepository;
    private final SessionQuestionRepository sessionQuestionRepository;
    private final QuestionRepository questionRepository;
    private final QuestionHistoryRepository historyRepository;
    private final QuestionAttemptRepository attemptRepository;
    private final CategoryMicroRatingRepository microRatingRepository;
    private final CategoryPriorityService priorityService;
    private final PriorityWeightCalculator weightCalculator;
    private final RatingCalculator ratingCalculator;
    private final RatingProperties ratingProperties;
    private final SessionStatsCalculator statsCalculator;
    private final EngineMetricsService metricsService;
    private final Clock clock;

    public SessionSettlementServiceImpl(PlatformTransactionManager transactionManager,
                                        LearnerRatingProvisioner learnerRatingProvisioner,
                                        LearnerRatingRepository learnerRatingRepository,
                                        QuizSessionRepository sessionRepository,
                                        SessionQuestionRepository sessionQuestionRepository,
                                        QuestionRepository questionRepository,
                                        QuestionHistoryRepository historyRepository,
                                        QuestionAttemptRepository attemptRepository,
                                        CategoryMicroRatingRepository microRatingRepository,
                                        CategoryPriorityService priorityService,
                                        PriorityWeightCalculator weightCalculator,
                                        RatingCalculator ratingCalculator,
                                        RatingProperties ratingProperties,
                                        SessionStatsCalculator statsCalculator,
                                        EngineMetricsService metricsService,
                                        Clock clock) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.learnerRatingProvisioner = learnerRatingProvisioner;
        this.learnerRatingRepository = learnerRatingRepository;
        this.sessionRepository = sessionRepository;
        this.sessionQuestionRepository = sessionQuestionRepository;
        this.questionRepository = questionRepository;
        this.historyRepository = historyRepository;
        this.attemptRepository = attemptRepository;
        this.microRatingRepository = microRatingRepository;
        this.priorityService = priorityService;
        this.weightCalculator = weightCalculator;
        this.ratingCalculator = ratingCalculator;
        this.ratingProperties = ratingProperties;
        this.statsCalculator = statsCalculator;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    @Override
    public SettlementResultDto completeSession(SettlementCommand command) {
        validateCommand(command);
        long startedNanos = System.nanoTime();

        learnerRatingProvisioner.ensureExists(command.learnerId());

        SettlementResultDto result;
        try {
            result = transactionTemplate.execute(status -> settle(new SettlementContext(
                    status,
                    command.learnerId(),
                    List.copyOf(command.attempts()),
                    Instant.now(clock)
            ), command.sessionId()));
        } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
            metricsService.incrementSettlementFailed();
            throw new SettlementFailedException(command.sessionId(), e);
        }

        long elapsedMs = (System.nanoTime() - startedNanos) / 1_000_000;
        metricsService.recordSettlement(result.sessionType().name(), elapsedMs, result.totalQuestions());
        log.info("Settled session {} for learner {}: correct={}/{}, rating {} -> {} ({}ms)",
                result.sessionId(), command.learnerId(), result.correctAnswers(), result.totalQuestions(),
                result.ratingBefore(), result.ratingAfter(), elapsedMs);
        return result;
    }

    private SettlementResultDto settle(SettlementContext ctx, UUID sessionId) {
        if (!ctx.getTransaction().isNewTransaction()) {
            log.warn("Settlement of session {} joined an existing transaction", sessionId);
        }
        lockRows(ctx, sessionId);

        QuizSession session = ctx.getSession();
        SessionStats stats = statsCalculator.calculate(ctx.getAttempts());
        applyStats(ctx, stats);

        updateHistory(ctx);

        int ratingBefore = ctx.getLearnerRating().getRating();
        List<QuestionAttempt> attemptRows = updateLearnerAndQuestions(ctx);
        attemptRepository.saveAll(attemptRows);

        List<CategorySettlementDto> categories = updateCategories(ctx);

        int ratingAfter = ctx.getLearnerRating().getRating();
        session.setRatingChange(ratingAfter - ratingBefore);
        sessionRepository.save(session);
        learnerRatingRepository.save(ctx.getLearnerRating());

        priorityService.recalculateAll(ctx.getLearnerId());

        return new SettlementResultDto(
                session.getId(),
                session.getStatus(),
                session.getSessionType(),
                stats.total(),
                stats.correct(),
                stats.incorrect(),
                stats.skipped(),
                stats.accuracyPercentage(),
                stats.averageTimePerQuestion(),
                stats.totalTimeSpentSeconds(),
                ratingBefore,
                ratingAfter,
                ratingAfter - ratingBefore,
                ctx.getSettledAt(),
                categories
        );
    }

    /**
     * Lock order: learner rating, session, questions by ascending id.
     */
    private void lockRows(SettlementContext ctx, UUID sessionId) {
        UUID learnerId = ctx.getLearnerId();
        ctx.setLearnerRating(learnerRatingRepository.findByLearnerIdForUpdate(learnerId)
                .orElseThrow(() -> new ResourceNotFoundException("Rating for learner " + learnerId + " not found")));

        QuizSession session = sessionRepository.findByIdAndLearnerIdForUpdate(sessionId, learnerId)
                .orElseThrow(() -> new ResourceNotFoundException("Quiz session " + sessionId + " not found"));
        if (session.getStatus().isTerminal()) {
            metricsService.incrementSettlementRejected(session.getStatus().name());
            throw new SessionStateException(session.getId(), session.getStatus(), "complete");
        }
        ctx.setSession(session);

        Map<UUID, SessionQuestion> assignments = sessionQuestionRepository.findAllForSettlement(sessionId)
                .stream()
                .collect(Collectors.toMap(sq -> sq.getQuestion().getId(), Function.identity()));
        Set<UUID> seen = new HashSet<>();
        for (AttemptSubmission attempt : ctx.getAttempts()) {
            if (!assignments.containsKey(attempt.questionId())) {
                metricsService.incrementSettlementRejected("UNASSIGNED_QUESTION");
                throw new ValidationException("Question " + attempt.questionId() + " is not part of session " + sessionId);
            }
            if (!seen.add(attempt.questionId())) {
                metricsService.incrementSettlementRejected("DUPLICATE_QUESTION");
                throw new ValidationException("Question " + attempt.questionId() + " was answered more than once");
            }
        }
        ctx.setAssignments(assignments);

        List<UUID> questionIds = seen.stream().sorted().toList();
        Map<UUID, Question> locked = questionRepository.findAllByIdInForUpdate(questionIds).stream()
                .collect(Collectors.toMap(Question::getId, Function.identity()));
        ctx.setLockedQuestions(locked);
    }

    private void applyStats(SettlementContext ctx, SessionStats stats) {
        QuizSession session = ctx.getSession();
        session.closePause(ctx.getSettledAt());
        session.setTotalQuestions(stats.total());
        session.setCorrectAnswers(stats.correct());
        session.setIncorrectAnswers(stats.incorrect());
        session.setSkippedAnswers(stats.skipped());
        session.setAccuracyPercentage(stats.accuracyPercentage());
        session.setAverageTimePerQuestion(stats.averageTimePerQuestion());
        session.setTotalTimeSpentSeconds(stats.totalTimeSpentSeconds());
        session.setStatus(SessionStatus.COMPLETED);
        session.setEndedAt(ctx.getSettledAt());
    }

    private void updateHistory(SettlementContext ctx) {
        List<UUID> questionIds = ctx.getAttempts().stream().map(AttemptSubmission::questionId).toList();
        Map<UUID, QuestionHistoryEntry> entries = historyRepository
                .findAllByLearnerIdAndQuestionIdIn(ctx.getLearnerId(), questionIds)
                .stream()
                .collect(Collectors.toMap(QuestionHistoryEntry::getQuestionId, Function.identity()));

        List<QuestionHistoryEntry> toSave = new ArrayList<>(ctx.getAttempts().size());
        for (AttemptSubmission attempt : ctx.getAttempts()) {
            QuestionHistoryEntry entry = entries.get(attempt.questionId());
            if (entry == null) {
                SessionQuestion assignment = ctx.assignmentOf(attempt);
                entry = new QuestionHistoryEntry();
                entry.setLearnerId(ctx.getLearnerId());
                entry.setQuestionId(attempt.questionId());
                entry.setCategory(assignment.getCategory());
                entry.setFirstSeenAt(ctx.getSettledAt());
                entry.setTimesSeen(1);
                entry.setLastSessionId(ctx.getSession().getId());
            }
            entry.setLastSeenAt(ctx.getSettledAt());
            if (attempt.correct()) {
                entry.recordCorrect(ctx.getSettledAt());
            } else {
                entry.recordIncorrect();
            }
            toSave.add(entry);
        }
        historyRepository.saveAll(toSave);
    }

    private List<QuestionAttempt> updateLearnerAndQuestions(SettlementContext ctx) {
        LearnerRating learner = ctx.getLearnerRating();
        SessionType sessionType = ctx.getSession().getSessionType();
        int gamesBefore = learner.getGamesPlayed();
        int rating = learner.getRating();
        int bestRating = Math.max(learner.getBestRating(), rating);
        int streak = learner.getCurrentStreak();
        int correctCount = 0;

        List<QuestionAttempt> rows = new ArrayList<>(ctx.getAttempts().size());
        for (int i = 0; i < ctx.getAttempts().size(); i++) {
            AttemptSubmission attempt = ctx.getAttempts().get(i);
            SessionQuestion assignment = ctx.assignmentOf(attempt);
            Question question = ctx.getLockedQuestions().get(attempt.questionId());

            int learnerK = ratingCalculator.adjustForSessionType(ratingCalculator.playerKFactor(gamesBefore + i), sessionType);
            int questionK = ratingCalculator.adjustForSessionType(ratingCalculator.questionKFactor(question.getTimesAnswered()), sessionType);
            RatingCalculator.RatingOutcome outcome = ratingCalculator.calculate(
                    rating, learnerK, assignment.getQuestionRatingAtSelection(), questionK, attempt.correct());

            question.setRating(Math.max(ratingProperties.getRatingFloor(), question.getRating() + outcome.opponentDelta()));
            question.setTimesAnswered(question.getTimesAnswered() + 1);
            if (attempt.correct()) {
                question.setTimesCorrect(question.getTimesCorrect() + 1);
                correctCount++;
                streak = streak > 0 ? streak + 1 : 1;
            } else {
                streak = streak < 0 ? streak - 1 : -1;
            }

            QuestionAttempt row = new QuestionAttempt();
            row.setSessionId(ctx.getSession().getId());
            row.setLearnerId(ctx.getLearnerId());
            row.setQuestionId(attempt.questionId());
            row.setCategoryId(assignment.getCategory().getId());
            row.setSubmittedAnswer(attempt.submittedAnswer());
            row.setCorrect(attempt.correct());
            row.setSkipped(attempt.skipped());
            row.setTimeSpentSeconds(Math.max(0, attempt.timeSpentSeconds()));
            row.setQuestionRatingAtSelection(assignment.getQuestionRatingAtSelection());
            row.setLearnerRatingBefore(rating);
            row.setLearnerRatingAfter(outcome.challengerRating());
            row.setPosition(i);
            row.setAnsweredAt(ctx.getSettledAt());
            rows.add(row);

            rating = outcome.challengerRating();
            bestRating = Math.max(bestRating, rating);
        }

        int total = ctx.getAttempts().size();
        learner.setRating(rating);
        learner.setBestRating(bestRating);
        learner.setGamesPlayed(gamesBefore + total);
        learner.setWins(learner.getWins() + correctCount);
        learner.setLosses(learner.getLosses() + (total - correctCount));
        learner.setCurrentStreak(streak);
        double sessionAccuracy = total == 0 ? 0.0 : (double) correctCount / total;
        learner.setConfidenceLevel(ratingCalculator.playerConfidence(learner.getGamesPlayed(), sessionAccuracy));
        learner.setUpdatedAt(ctx.getSettledAt());
        return rows;
    }

    private List<CategorySettlementDto> updateCategories(SettlementContext ctx) {
        Map<UUID, List<AttemptSubmission>> byCategory = new LinkedHashMap<>();
        Map<UUID, Category> categories = new HashMap<>();
        for (AttemptSubmission attempt : ctx.getAttempts()) {
            Category category = ctx.assignmentOf(attempt).getCategory();
            categories.putIfAbsent(category.getId(), category);
            byCategory.computeIfAbsent(category.getId(), id -> new ArrayList<>()).add(attempt);
        }

        SessionType sessionType = ctx.getSession().getSessionType();
        List<CategorySettlementDto> results = new ArrayList<>(byCategory.size());
        for (Map.Entry<UUID, List<AttemptSubmission>> group : byCategory.entrySet()) {
            UUID categoryId = group.getKey();
            Category category = categories.get(categoryId);
            CategoryMicroRating micro = microRatingRepository.findByLearnerIdAndCategory_Id(ctx.getLearnerId(), categoryId)
                    .orElseGet(() -> CategoryMicroRating.baseline(ctx.getLearnerId(), category, ratingProperties.getBaselineRating()));

            int ratingBefore = micro.getRating();
            int correctHere = 0;
            for (AttemptSubmission attempt : group.getValue()) {
                int frozenRating = ctx.assignmentOf(attempt).getQuestionRatingAtSelection();
                int categoryK = ratingCalculator.adjustForSessionType(ratingCalculator.categoryKFactor(micro.getAttempts()), sessionType);
                RatingCalculator.RatingOutcome outcome = ratingCalculator.calculate(
                        micro.getRating(), categoryK, frozenRating, categoryK, attempt.correct());
                micro.setRating(outcome.challengerRating());
                micro.setAttempts(micro.getAttempts() + 1);
                if (attempt.correct()) {
                    micro.setCorrectAttempts(micro.getCorrectAttempts() + 1);
                    correctHere++;
                }
            }

            micro.setSuccessRate((double) micro.getCorrectAttempts() / micro.getAttempts());
            micro.setRecentAccuracy(recentAccuracy(ctx.getLearnerId(), categoryId));
            micro.setTrend(trendOf(micro.getRecentAccuracy(), micro.getSuccessRate()));
            micro.setQuestionsMastered((int) historyRepository
                    .countRetiredInCategory(ctx.getLearnerId(), categoryId));
            micro.setPriorityScore(weightCalculator.weight(micro.getRating(), micro.getSuccessRate()));
            micro.setLastAttemptAt(ctx.getSettledAt());
            microRatingRepository.save(micro);

            results.add(new CategorySettlementDto(
                    categoryId,
                    category.getName(),
                    group.getValue().size(),
                    correctHere,
                    ratingBefore,
                    micro.getRating(),
                    micro.getSuccessRate(),
                    micro.getRecentAccuracy(),
                    micro.getTrend()
            ));
        }
        return results;
    }

    private double recentAccuracy(UUID learnerId, UUID categoryId) {
        List<Boolean> outcomes = attemptRepository.findRecentOutcomes(
                learnerId, categoryId, PageRequest.of(0, RECENT_ACCURACY_WINDOW));
        if (outcomes.isEmpty()) {
            return 0.0;
        }
        long correct = outcomes.stream().filter(Boolean.TRUE::equals).count();
        return (double) correct / outcomes.size();
    }

    private PerformanceTrend trendOf(double recentAccuracy, double successRate) {
        if (recentAccuracy > successRate + TREND_THRESHOLD) return PerformanceTrend.IMPROVING;
        if (recentAccuracy < successRate - TREND_THRESHOLD) return PerformanceTrend.DECLINING;
        return PerformanceTrend.STABLE;
    }

    private void validateCommand(SettlementCommand command) {
        if (command == null || command.sessionId() == null || command.learnerId() == null) {
            throw new ValidationException("Session and learner are required for settlement");
        }
        if (command.attempts() == null || command.attempts().isEmpty()) {
            throw new ValidationException("At least one attempt is required to complete a session");
        }
        for (AttemptSubmission attempt : command.attempts()) {
            if (attempt == null || attempt.questionId() == null) {
                throw new ValidationException("Every attempt must reference a question");
            }
            if (attempt.timeSpentSeconds() < 0) {
                throw new ValidationException("Time spent must not be negative");
            }
        }
    }
}
