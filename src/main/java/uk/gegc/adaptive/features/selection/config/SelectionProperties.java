package uk.gegc.adaptive.features.selection.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.adaptive.features.session.domain.model.SessionType;

import java.util.EnumMap;
import java.util.Map;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "assessment.selection")
public class SelectionProperties {

    /**
     * Half-width of the rating window around the learner's rating.
     */
    @Positive
    private int ratingTolerance = 200;

    /**
     * Optional per-session-type tolerance overrides.
     */
    private Map<SessionType, Integer> sessionTypeTolerances = new EnumMap<>(SessionType.class);

    /**
     * Questions last seen in this many of the learner's most recent sessions are not offered again.
     */
    @Min(0)
    private int recentSessionExclusion = 3;

    public int toleranceFor(SessionType sessionType) {
        if (sessionType == null) {
            return ratingTolerance;
        }
        return sessionTypeTolerances.getOrDefault(sessionType, ratingTolerance);
    }
}
