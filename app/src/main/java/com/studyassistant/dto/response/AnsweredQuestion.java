package com.studyassistant.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A quiz question together with the choice the user made.
 * A null {@code chosenIndex} means the question was skipped.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnsweredQuestion {

    private QuizQuestion question;

    @JsonProperty("chosen_index")
    private Integer chosenIndex;

    @JsonIgnore
    public boolean isCorrect() {
        return chosenIndex != null
                && question != null
                && chosenIndex.equals(question.getCorrectIndex());
    }
}
