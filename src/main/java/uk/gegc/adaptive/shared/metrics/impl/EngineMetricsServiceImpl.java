package uk.gegc.adaptive.shared.metrics.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.adaptive.shared.metrics.EngineMetricsService;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed engine metrics.
 */
@Slf4j
@Service
public class EngineMetricsServiceImpl implements EngineMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter settlementFailedCounter;
    private final DistributionSummary quizShortfallSummary;

    public EngineMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.settlementFailedCounter = Counter.builder("assessment.settlement.failed")
                .description("Number of settlements rolled back on lock or constraint failures")
                .register(meterRegistry);
        this.quizShortfallSummary = DistributionSummary.builder("assessment.quiz.shortfall")
                .description("Requested minus selected questions per generated quiz")
                .register(meterRegistry);
    }

    @Override
    public void incrementQuizGenerated(String sessionType, int requested, int selected) {
        Counter.builder("assessment.quiz.generated")
                .description("Number of adaptive quizzes generated")
                .tag("sessionType", sessionType)
                .register(meterRegistry)
                .increment();
        quizShortfallSummary.record(Math.max(0, requested - selected));
        log.debug("Metric: quiz generated - sessionType={}, requested={}, selected={}", sessionType, requested, selected);
    }

    @Override
    public void incrementUnderfilledQuiz(String sessionType) {
        Counter.builder("assessment.quiz.underfilled")
                .description("Number of quizzes that selected fewer questions than requested")
                .tag("sessionType", sessionType)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordSettlement(String sessionType, long durationMs, int answeredQuestions) {
        Timer.builder("assessment.settlement.latency")
                .description("Time to settle a completed session")
                .tag("sessionType", sessionType)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        Counter.builder("assessment.settlement.answers")
                .description("Number of answers settled")
                .tag("sessionType", sessionType)
                .register(meterRegistry)
                .increment(answeredQuestions);
    }

    @Override
    public void incrementSettlementRejected(String reason) {
        Counter.builder("assessment.settlement.rejected")
                .description("Number of settlement requests rejected before any change")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementSettlementFailed() {
        settlementFailedCounter.increment();
    }
}
