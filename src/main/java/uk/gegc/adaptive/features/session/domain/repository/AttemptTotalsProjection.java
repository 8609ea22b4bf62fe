package uk.gegc.adaptive.features.session.domain.repository;

import java.time.Instant;

/**
 * Aggregates over all settled answers of one learner. Sums and averages are null when there are none.
 */
public interface AttemptTotalsProjection {
    long getTotalAnswered();

    Long getTotalCorrect();

    Double getAverageTimeSeconds();

    Instant getFirstAnsweredAt();

    Instant getLastAnsweredAt();
}
