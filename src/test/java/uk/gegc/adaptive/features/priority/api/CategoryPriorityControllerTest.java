package uk.gegc.adaptive.features.priority.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.adaptive.features.priority.application.CategoryPriorityService;
import uk.gegc.adaptive.features.priority.application.dto.CategoryPriorityDto;
import uk.gegc.adaptive.shared.api.ApiHeaders;

import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CategoryPriorityController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("CategoryPriorityController")
class CategoryPriorityControllerTest {

    private static final UUID LEARNER_ID = UUID.fromString("10000000-0000-0000-0000-000000000001");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CategoryPriorityService priorityService;

    @Test
    @DisplayName("GET /api/v1/priorities defaults to the top three")
    void getTopPriorities_defaultLimit() throws Exception {
        UUID categoryId = UUID.randomUUID();
        when(priorityService.topPriorities(LEARNER_ID, 3)).thenReturn(List.of(
                new CategoryPriorityDto(categoryId, "Operating Systems", 7.5, 12, 350, 0.4, 1150, 0.4, null)));

        mockMvc.perform(get("/api/v1/priorities").header(ApiHeaders.LEARNER_ID, LEARNER_ID.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].categoryId").value(categoryId.toString()))
                .andExpect(jsonPath("$[0].priorityWeight").value(7.5))
                .andExpect(jsonPath("$[0].questionsNeeded").value(12));
    }

    @Test
    @DisplayName("GET /api/v1/priorities passes an explicit limit through")
    void getTopPriorities_explicitLimit() throws Exception {
        when(priorityService.topPriorities(LEARNER_ID, 10)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/priorities")
                        .param("limit", "10")
                        .header(ApiHeaders.LEARNER_ID, LEARNER_ID.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        verify(priorityService).topPriorities(LEARNER_ID, 10);
    }

    @Test
    @DisplayName("limit outside 1..50 returns 400")
    void getTopPriorities_invalidLimit_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/priorities")
                        .param("limit", "0")
                        .header(ApiHeaders.LEARNER_ID, LEARNER_ID.toString()))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(priorityService);
    }

    @Test
    @DisplayName("malformed learner id returns 400")
    void getTopPriorities_malformedLearnerId_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/priorities").header(ApiHeaders.LEARNER_ID, "not-a-uuid"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(priorityService);
    }
}
