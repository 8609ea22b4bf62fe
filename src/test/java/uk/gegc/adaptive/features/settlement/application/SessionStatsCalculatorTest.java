package uk.gegc.adaptive.features.settlement.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.adaptive.features.settlement.application.dto.AttemptSubmission;
import uk.gegc.adaptive.features.settlement.application.dto.SessionStats;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("SessionStatsCalculator unit tests")
class SessionStatsCalculatorTest {

    private final SessionStatsCalculator calculator = new SessionStatsCalculator();

    @Test
    @DisplayName("calculate: 7 of 10 correct over 225s gives 70.00% and 22.50s")
    void calculate_sevenOfTen() {
        List<AttemptSubmission> attempts = new ArrayList<>();
        int[] times = {20, 25, 15, 30, 22, 18, 25, 20, 30, 20};
        for (int i = 0; i < 10; i++) {
            boolean correct = i < 7;
            String answer = i == 9 ? "" : (correct ? "right" : "wrong");
            attempts.add(new AttemptSubmission(UUID.randomUUID(), answer, correct, times[i]));
        }

        SessionStats stats = calculator.calculate(attempts);

        assertEquals(10, stats.total());
        assertEquals(7, stats.correct());
        assertEquals(2, stats.incorrect());
        assertEquals(1, stats.skipped());
        assertEquals(new BigDecimal("70.00"), stats.accuracyPercentage());
        assertEquals(new BigDecimal("22.50"), stats.averageTimePerQuestion());
        assertEquals(225, stats.totalTimeSpentSeconds());
    }

    @Test
    @DisplayName("calculate: blank and null answers count as skipped, not incorrect")
    void calculate_blankAnswers_areSkipped() {
        SessionStats stats = calculator.calculate(List.of(
                new AttemptSubmission(UUID.randomUUID(), null, false, 5),
                new AttemptSubmission(UUID.randomUUID(), "   ", false, 5),
                new AttemptSubmission(UUID.randomUUID(), "B", false, 5)
        ));

        assertEquals(2, stats.skipped());
        assertEquals(1, stats.incorrect());
        assertEquals(new BigDecimal("0.00"), stats.accuracyPercentage());
    }

    @Test
    @DisplayName("calculate: accuracy is rounded half up to two decimals")
    void calculate_roundsAccuracy() {
        SessionStats stats = calculator.calculate(List.of(
                new AttemptSubmission(UUID.randomUUID(), "A", true, 10),
                new AttemptSubmission(UUID.randomUUID(), "B", false, 10),
                new AttemptSubmission(UUID.randomUUID(), "C", false, 11)
        ));

        assertEquals(new BigDecimal("33.33"), stats.accuracyPercentage());
        assertEquals(new BigDecimal("10.33"), stats.averageTimePerQuestion());
    }
}
