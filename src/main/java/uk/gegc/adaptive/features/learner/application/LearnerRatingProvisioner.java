package uk.gegc.adaptive.features.learner.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.adaptive.features.learner.domain.model.LearnerRating;
import uk.gegc.adaptive.features.learner.domain.repository.LearnerRatingRepository;
import uk.gegc.adaptive.features.rating.config.RatingProperties;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Creates the baseline rating row of a first-time learner in its own transaction, so that the row
 * exists (and can be locked) before a settlement starts. Two racing creations resolve to one row.
 */
@Slf4j
@Component
public class LearnerRatingProvisioner {

    private final LearnerRatingRepository learnerRatingRepository;
    private final RatingProperties ratingProperties;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public LearnerRatingProvisioner(LearnerRatingRepository learnerRatingRepository,
                                    RatingProperties ratingProperties,
                                    PlatformTransactionManager transactionManager,
                                    Clock clock) {
        this.learnerRatingRepository = learnerRatingRepository;
        this.ratingProperties = ratingProperties;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public void ensureExists(UUID learnerId) {
        if (learnerRatingRepository.existsByLearnerId(learnerId)) {
            return;
        }
        try {
            requiresNew.executeWithoutResult(status -> {
                if (!learnerRatingRepository.existsByLearnerId(learnerId)) {
                    learnerRatingRepository.saveAndFlush(LearnerRating.baseline(
                            learnerId, ratingProperties.getBaselineRating(), Instant.now(clock)));
                    log.info("Provisioned baseline rating for learner {}", learnerId);
                }
            });
        } catch (DataIntegrityViolationException e) {
            // another request created the row first
            log.debug("Learner rating for {} created concurrently, reusing existing row", learnerId);
        }
    }

    public int currentRating(UUID learnerId) {
        return learnerRatingRepository.findByLearnerId(learnerId)
                .map(LearnerRating::getRating)
                .orElse(ratingProperties.getBaselineRating());
    }
}
