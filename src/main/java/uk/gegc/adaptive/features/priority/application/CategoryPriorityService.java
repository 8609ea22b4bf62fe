package uk.gegc.adaptive.features.priority.application;

import uk.gegc.adaptive.features.priority.application.dto.CategoryPriorityDto;

import java.util.List;
import java.util.UUID;

public interface CategoryPriorityService {

    /**
     * Recomputes the practice priority of every category the learner has a micro-rating in.
     * Repeating the call with unchanged inputs leaves every row untouched.
     *
     * @return number of rows inserted or changed
     */
    int recalculateAll(UUID learnerId);

    /**
     * Highest-weight categories first; equal weights ordered by category id.
     */
    List<CategoryPriorityDto> topPriorities(UUID learnerId, int limit);
}
