package com.studyassistant.dto.response;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One multiple-choice question of a generated quiz.
 *
 * Deserialized from the model's JSON answer and serialized back into
 * {@code quiz_results.questions_data}. Example item:
 * <pre>
 * {
 *   "question": "Which organelle produces ATP?",
 *   "choices": ["Nucleus", "Mitochondrion", "Ribosome", "Golgi apparatus"],
 *   "correct_index": 1,
 *   "explanation": "Mitochondria run cellular respiration."
 * }
 * </pre>
 * Models do not always use the same field names, so common aliases are
 * accepted on input.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QuizQuestion {

    public static final int CHOICE_COUNT = 4;

    @JsonAlias({"question_text", "questionText", "prompt"})
    private String question;

    @JsonAlias({"options", "answers"})
    private List<String> choices;

    @JsonProperty("correct_index")
    @JsonAlias({"correctIndex", "correct_option_index", "correct_answer_index", "answer_index"})
    private Integer correctIndex;

    private String explanation;
}
