package uk.gegc.adaptive.features.rating.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.adaptive.features.session.domain.model.SessionType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "assessment.rating")
public class RatingProperties {

    /**
     * Rating of a learner, a category micro-rating or a question that has no history yet.
     */
    @Min(0)
    private int baselineRating = 1500;

    /**
     * Lowest rating any entity can reach.
     */
    @Min(0)
    private int ratingFloor = 0;

    /**
     * Staged learner K-factor, applied by games played. Bands must be ordered by {@code maxGames}
     * with non-increasing K.
     */
    @Valid
    @NotEmpty
    private List<KFactorBand> playerKFactorBands = new ArrayList<>(List.of(
            new KFactorBand(44, 100),
            new KFactorBand(200, 60),
            new KFactorBand(400, 40),
            new KFactorBand(600, 24),
            new KFactorBand(800, 16)
    ));

    /**
     * K-factor once every band is exhausted.
     */
    @Positive
    private int playerKFactorFloor = 10;

    @Positive
    private int questionProvisionalKFactor = 40;

    @Positive
    private int questionEstablishedKFactor = 16;

    /**
     * Number of ratings after which a question uses the established K-factor.
     */
    @Positive
    private int questionProvisionalThreshold = 20;

    @DecimalMin("0.0")
    @DecimalMax("0.99")
    private double confidenceCap = 0.95;

    @Positive
    private int reliabilitySaturation = 100;

    @Positive
    private int confidenceGamesSaturation = 50;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceExperienceWeight = 0.7;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidencePerformanceWeight = 0.3;

    /**
     * Optional per-session-type multiplier on every K-factor. Types not listed use 1.0.
     */
    private Map<SessionType, Double> sessionTypeKMultipliers = new EnumMap<>(SessionType.class);

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class KFactorBand {

        @Min(0)
        private int maxGames;

        @Positive
        private int factor;
    }
}
