package uk.gegc.adaptive.features.question.infra.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import uk.gegc.adaptive.features.question.domain.model.Question;
import uk.gegc.adaptive.features.session.application.dto.SessionQuestionDto;
import uk.gegc.adaptive.features.session.domain.model.SessionQuestion;

import java.util.List;

@Component
public class QuestionMapper {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> OPTIONS_TYPE = new TypeReference<>() {
    };

    public static SessionQuestionDto toSessionQuestionDto(SessionQuestion assignment) {
        Question question = assignment.getQuestion();
        return new SessionQuestionDto(
                assignment.getPosition(),
                question.getId(),
                question.getQuestionText(),
                readOptions(question),
                question.getCorrectAnswer(),
                question.getExplanation(),
                assignment.getCategory().getId(),
                assignment.getCategory().getName(),
                assignment.getQuestionRatingAtSelection()
        );
    }

    public static List<String> readOptions(Question question) {
        String raw = question.getOptions();
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(raw, OPTIONS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                    "Failed to parse options JSON for question " + question.getId(), e
            );
        }
    }

    public static String writeOptions(List<String> options) {
        try {
            return MAPPER.writeValueAsString(options == null ? List.of() : options);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize question options", e);
        }
    }
}
