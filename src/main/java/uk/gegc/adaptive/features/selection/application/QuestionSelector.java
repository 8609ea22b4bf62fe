package uk.gegc.adaptive.features.selection.application;

import uk.gegc.adaptive.features.selection.application.dto.RankedQuestion;
import uk.gegc.adaptive.features.selection.application.dto.SelectionCriteria;

import java.util.List;

public interface QuestionSelector {

    /**
     * Ranks the eligible questions of one category for one learner and returns at most
     * {@code desiredCount} of them. Fewer results (including none) are not an error.
     */
    List<RankedQuestion> select(SelectionCriteria criteria);
}
