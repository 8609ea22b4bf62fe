package uk.gegc.adaptive.features.generation.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.adaptive.features.generation.application.dto.CategoryAllocation;
import uk.gegc.adaptive.features.generation.application.dto.WeightedCategory;
import uk.gegc.adaptive.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("QuestionDistributor unit tests")
class QuestionDistributorTest {

    private final QuestionDistributor distributor = new QuestionDistributor();

    @Test
    @DisplayName("distribute: weights 3,1,1 over 20 questions give 12,4,4")
    void distribute_proportionalSplit() {
        List<CategoryAllocation> result = distributor.distribute(categories(3.0, 1.0, 1.0), 20);

        assertThat(result).extracting(CategoryAllocation::requested).containsExactly(12, 4, 4);
    }

    @Test
    @DisplayName("distribute: rounding remainder goes to the highest-weight category")
    void distribute_remainderToTopCategory() {
        List<CategoryAllocation> result = distributor.distribute(categories(1.0, 1.0, 1.0), 10);

        assertThat(result).extracting(CategoryAllocation::requested).containsExactly(4, 3, 3);
    }

    @Test
    @DisplayName("distribute: equal weights keep the caller's order")
    void distribute_equalWeights_keepOrder() {
        List<WeightedCategory> input = categories(1.0, 1.0, 1.0);

        List<CategoryAllocation> result = distributor.distribute(input, 10);

        assertThat(result).extracting(CategoryAllocation::categoryId)
                .containsExactly(input.get(0).categoryId(), input.get(1).categoryId(), input.get(2).categoryId());
    }

    @Test
    @DisplayName("distribute: a correction that would empty the top category borrows from the next ones")
    void distribute_negativeCorrection_borrowsFromNext() {
        List<CategoryAllocation> result = distributor.distribute(categories(1.0, 1.0, 1.0, 1.0), 6);

        assertThat(result).extracting(CategoryAllocation::requested).containsExactly(1, 1, 2, 2);
    }

    @Test
    @DisplayName("distribute: fewer questions than categories uses only the heaviest ones")
    void distribute_totalBelowCategoryCount() {
        List<WeightedCategory> input = categories(0.5, 7.5, 3.0);

        List<CategoryAllocation> result = distributor.distribute(input, 2);

        assertThat(result).extracting(CategoryAllocation::categoryId)
                .containsExactly(input.get(1).categoryId(), input.get(2).categoryId());
        assertThat(result).extracting(CategoryAllocation::requested).containsExactly(1, 1);
    }

    @Test
    @DisplayName("distribute: counts always add up to the total and none is below one")
    void distribute_sumsToTotal_andAtLeastOne() {
        double[][] weightSets = {
                {7.5}, {7.5, 0.5}, {3.0, 1.0, 1.0}, {7.5, 0.5, 0.5, 0.5, 0.5},
                {1.5, 1.5, 1.0}, {0.5, 0.5, 0.5, 0.5, 0.5, 0.5, 0.5}, {7.5, 3.0, 1.5, 1.0, 0.5}
        };
        for (double[] weights : weightSets) {
            for (int total = weights.length; total <= 60; total++) {
                List<CategoryAllocation> result = distributor.distribute(categories(weights), total);

                assertEquals(total, result.stream().mapToInt(CategoryAllocation::requested).sum());
                assertThat(result).allSatisfy(a -> assertThat(a.requested()).isGreaterThanOrEqualTo(1));
            }
        }
    }

    @Test
    @DisplayName("distribute: non-positive total or no categories is rejected")
    void distribute_invalidInput_throws() {
        assertThrows(ValidationException.class, () -> distributor.distribute(categories(1.0), 0));
        assertThrows(ValidationException.class, () -> distributor.distribute(List.of(), 5));
    }

    private List<WeightedCategory> categories(double... weights) {
        List<WeightedCategory> result = new ArrayList<>();
        for (int i = 0; i < weights.length; i++) {
            result.add(new WeightedCategory(UUID.randomUUID(), "Category " + i, weights[i]));
        }
        return result;
    }
}
