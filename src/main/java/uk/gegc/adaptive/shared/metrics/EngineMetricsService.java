package uk.gegc.adaptive.shared.metrics;

/**
 * Counters and timers of quiz generation and settlement.
 */
public interface EngineMetricsService {

    void incrementQuizGenerated(String sessionType, int requested, int selected);

    void incrementUnderfilledQuiz(String sessionType);

    void recordSettlement(String sessionType, long durationMs, int answeredQuestions);

    void incrementSettlementRejected(String reason);

    void incrementSettlementFailed();
}
