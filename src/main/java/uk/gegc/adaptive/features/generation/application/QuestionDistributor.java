package uk.gegc.adaptive.features.generation.application;

import org.springframework.stereotype.Component;
import uk.gegc.adaptive.features.generation.application.dto.CategoryAllocation;
import uk.gegc.adaptive.features.generation.application.dto.WeightedCategory;
import uk.gegc.adaptive.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits a question total across weighted categories. Counts always add up to the total and no
 * participating category gets fewer than one question.
 */
@Component
public class QuestionDistributor {

    public List<CategoryAllocation> distribute(List<WeightedCategory> categories, int total) {
        if (total <= 0) {
            throw new ValidationException("Question count must be positive");
        }
        if (categories == null || categories.isEmpty()) {
            throw new ValidationException("At least one category is required for distribution");
        }

        // stable sort: equal weights keep the caller's order
        List<WeightedCategory> ordered = new ArrayList<>(categories);
        ordered.sort(Comparator.comparingDouble(WeightedCategory::weight).reversed());
        if (ordered.size() > total) {
            ordered = new ArrayList<>(ordered.subList(0, total));
        }

        double weightSum = ordered.stream().mapToDouble(c -> Math.max(0.0, c.weight())).sum();
        int[] counts = new int[ordered.size()];
        int assigned = 0;
        for (int i = 0; i < ordered.size(); i++) {
            double share = weightSum > 0
                    ? total * Math.max(0.0, ordered.get(i).weight()) / weightSum
                    : (double) total / ordered.size();
            counts[i] = (int) Math.max(1, Math.round(share));
            assigned += counts[i];
        }

        counts[0] += total - assigned;
        if (counts[0] < 1) {
            int deficit = 1 - counts[0];
            counts[0] = 1;
            for (int i = 1; i < counts.length && deficit > 0; i++) {
                int take = Math.min(deficit, counts[i] - 1);
                counts[i] -= take;
                deficit -= take;
            }
        }

        List<CategoryAllocation> allocations = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            WeightedCategory category = ordered.get(i);
            allocations.add(new CategoryAllocation(
                    category.categoryId(), category.categoryName(), category.weight(), counts[i]));
        }
        return allocations;
    }
}
