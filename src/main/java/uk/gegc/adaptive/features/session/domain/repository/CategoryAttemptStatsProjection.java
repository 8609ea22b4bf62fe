package uk.gegc.adaptive.features.session.domain.repository;

import java.util.UUID;

public interface CategoryAttemptStatsProjection {
    UUID getCategoryId();

    long getAttempts();

    long getCorrect();

    double getAverageTimeSeconds();
}
