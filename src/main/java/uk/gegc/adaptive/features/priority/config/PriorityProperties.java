package uk.gegc.adaptive.features.priority.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "assessment.priority")
public class PriorityProperties {

    /**
     * Category ratings below this value get {@link #weakRatingMultiplier}.
     */
    private int weakRatingThreshold = 1200;

    /**
     * Category ratings below this value (and not weak) get {@link #developingRatingMultiplier}.
     */
    private int developingRatingThreshold = 1400;

    @Positive
    private double weakRatingMultiplier = 3.0;

    @Positive
    private double developingRatingMultiplier = 2.0;

    @Positive
    private double strongRatingMultiplier = 1.0;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double lowAccuracyThreshold = 0.50;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double moderateAccuracyThreshold = 0.70;

    @Positive
    private double lowAccuracyMultiplier = 2.5;

    @Positive
    private double moderateAccuracyMultiplier = 1.5;

    @Positive
    private double highAccuracyMultiplier = 0.5;

    /**
     * Rating a learner is steered towards; the rating deficit is measured against it.
     */
    private int targetRating = 1500;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double targetAccuracy = 0.80;

    /**
     * Base gap before the next recommended practice, divided by the category weight.
     */
    @NotNull
    private Duration basePracticeInterval = Duration.ofHours(72);

    /**
     * Number of top-priority categories a quiz draws from when none are requested.
     */
    @Positive
    private int defaultCategoryCount = 3;
}
