package uk.gegc.adaptive.features.priority.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.adaptive.features.priority.config.PriorityProperties;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Component
@RequiredArgsConstructor
public class PriorityWeightCalculator {

    private final PriorityProperties properties;

    public double weight(int categoryRating, double successRate) {
        return ratingMultiplier(categoryRating) * accuracyMultiplier(successRate);
    }

    public double ratingMultiplier(int categoryRating) {
        if (categoryRating < properties.getWeakRatingThreshold()) return properties.getWeakRatingMultiplier();
        if (categoryRating < properties.getDevelopingRatingThreshold()) return properties.getDevelopingRatingMultiplier();
        return properties.getStrongRatingMultiplier();
    }

    public double accuracyMultiplier(double successRate) {
        if (successRate < properties.getLowAccuracyThreshold()) return properties.getLowAccuracyMultiplier();
        if (successRate < properties.getModerateAccuracyThreshold()) return properties.getModerateAccuracyMultiplier();
        return properties.getHighAccuracyMultiplier();
    }

    public int ratingDeficit(int categoryRating) {
        return properties.getTargetRating() - categoryRating;
    }

    public double accuracyDeficit(double successRate) {
        return properties.getTargetAccuracy() - successRate;
    }

    public Instant nextPracticeAt(Instant lastAttemptAt, double weight) {
        if (lastAttemptAt == null || weight <= 0) return null;
        long gapSeconds = Math.round(properties.getBasePracticeInterval().getSeconds() / weight);
        return lastAttemptAt.plus(Duration.ofSeconds(gapSeconds)).truncatedTo(ChronoUnit.SECONDS);
    }
}
