package uk.gegc.adaptive.features.question.domain.repository;

import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import uk.gegc.adaptive.features.question.domain.model.Question;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

public final class QuestionSpecifications {

    private QuestionSpecifications() {
    }

    /**
     * Active questions tagged to {@code categoryId} whose rating lies in {@code [minRating, maxRating]},
     * or whose id is queued. Excluded ids are removed. Empty id sets contribute no predicate.
     */
    public static Specification<Question> selectionPool(UUID categoryId,
                                                        int minRating,
                                                        int maxRating,
                                                        Set<UUID> queuedIds,
                                                        Set<UUID> excludedIds) {
        return (root, query, cb) -> {
            if (query != null) {
                query.distinct(true);
            }

            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.isTrue(root.get("active")));

            var categoryJoin = root.join("categories", JoinType.INNER);
            predicates.add(cb.equal(categoryJoin.get("id"), categoryId));

            Predicate inWindow = cb.between(root.get("rating"), minRating, maxRating);
            if (queuedIds != null && !queuedIds.isEmpty()) {
                predicates.add(cb.or(inWindow, root.get("id").in(queuedIds)));
            } else {
                predicates.add(inWindow);
            }

            if (excludedIds != null && !excludedIds.isEmpty()) {
                predicates.add(cb.not(root.get("id").in(excludedIds)));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
