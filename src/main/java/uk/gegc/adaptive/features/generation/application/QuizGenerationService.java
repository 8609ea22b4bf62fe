package uk.gegc.adaptive.features.generation.application;

import uk.gegc.adaptive.features.generation.application.dto.GenerateQuizCommand;
import uk.gegc.adaptive.features.generation.application.dto.GeneratedQuizDto;

public interface QuizGenerationService {

    GeneratedQuizDto generateQuiz(GenerateQuizCommand command);
}
