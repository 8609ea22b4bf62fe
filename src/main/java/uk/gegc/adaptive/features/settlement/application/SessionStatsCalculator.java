package uk.gegc.adaptive.features.settlement.application;

import org.springframework.stereotype.Component;
import uk.gegc.adaptive.features.settlement.application.dto.AttemptSubmission;
import uk.gegc.adaptive.features.settlement.application.dto.SessionStats;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

@Component
public class SessionStatsCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public SessionStats calculate(List<AttemptSubmission> attempts) {
        int total = attempts.size();
        int correct = 0;
        int skipped = 0;
        long totalTime = 0;
        for (AttemptSubmission attempt : attempts) {
            if (attempt.correct()) {
                correct++;
            } else if (attempt.skipped()) {
                skipped++;
            }
            totalTime += Math.max(0, attempt.timeSpentSeconds());
        }
        int incorrect = total - correct - skipped;

        BigDecimal accuracy = total == 0
                ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(correct).multiply(HUNDRED).divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
        BigDecimal averageTime = total == 0
                ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(totalTime).divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);

        return new SessionStats(total, correct, incorrect, skipped, accuracy, averageTime, totalTime);
    }
}
