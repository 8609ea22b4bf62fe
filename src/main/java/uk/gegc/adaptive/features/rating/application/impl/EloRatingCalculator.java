package uk.gegc.adaptive.features.rating.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.adaptive.features.rating.application.RatingCalculator;
import uk.gegc.adaptive.features.rating.config.RatingProperties;
import uk.gegc.adaptive.features.session.domain.model.SessionType;

@Component
@RequiredArgsConstructor
public class EloRatingCalculator implements RatingCalculator {

    private static final double SCALE = 400.0;

    private final RatingProperties properties;

    @Override
    public double expectedScore(int rating, int opponentRating) {
        return 1.0 / (1.0 + Math.pow(10.0, (opponentRating - rating) / SCALE));
    }

    @Override
    public RatingOutcome calculate(int challengerRating, int challengerKFactor,
                                   int opponentRating, int opponentKFactor,
                                   boolean challengerSucceeded) {
        double expected = expectedScore(challengerRating, opponentRating);
        double actual = challengerSucceeded ? 1.0 : 0.0;

        long rawChallengerDelta = Math.round(challengerKFactor * (actual - expected));
        long rawOpponentDelta = Math.round(opponentKFactor * ((1.0 - actual) - (1.0 - expected)));

        int newChallenger = clamp(challengerRating + rawChallengerDelta);
        int newOpponent = clamp(opponentRating + rawOpponentDelta);

        return new RatingOutcome(
                newChallenger,
                newChallenger - challengerRating,
                newOpponent,
                newOpponent - opponentRating,
                expected
        );
    }

    @Override
    public int playerKFactor(int gamesPlayed) {
        for (RatingProperties.KFactorBand band : properties.getPlayerKFactorBands()) {
            if (gamesPlayed <= band.getMaxGames()) {
                return band.getFactor();
            }
        }
        return properties.getPlayerKFactorFloor();
    }

    @Override
    public int questionKFactor(int timesRated) {
        return timesRated < properties.getQuestionProvisionalThreshold()
                ? properties.getQuestionProvisionalKFactor()
                : properties.getQuestionEstablishedKFactor();
    }

    @Override
    public int categoryKFactor(int attempts) {
        return playerKFactor(attempts);
    }

    @Override
    public int adjustForSessionType(int kFactor, SessionType sessionType) {
        if (sessionType == null) {
            return kFactor;
        }
        Double multiplier = properties.getSessionTypeKMultipliers().get(sessionType);
        if (multiplier == null) {
            return kFactor;
        }
        return Math.max(1, (int) Math.round(kFactor * multiplier));
    }

    @Override
    public double questionReliability(int timesRated) {
        double reliability = (double) Math.max(0, timesRated) / properties.getReliabilitySaturation();
        return Math.min(properties.getConfidenceCap(), reliability);
    }

    @Override
    public double playerConfidence(int gamesPlayed, double recentPerformance) {
        double experience = Math.min(1.0, (double) Math.max(0, gamesPlayed) / properties.getConfidenceGamesSaturation());
        double performance = Math.max(0.0, Math.min(1.0, recentPerformance));
        double confidence = properties.getConfidenceExperienceWeight() * experience
                + properties.getConfidencePerformanceWeight() * performance;
        return Math.min(properties.getConfidenceCap(), confidence);
    }

    private int clamp(long rating) {
        return (int) Math.max(properties.getRatingFloor(), rating);
    }
}
