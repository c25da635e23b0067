package com.studyassistant.dto.response;

import com.studyassistant.entity.QuizResult;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * A stored quiz result with its questions, for the Review Hub.
 * {@code answers} is empty for results recorded without question data.
 */
@Data
@AllArgsConstructor
public class QuizReview {

    private QuizResult result;

    private List<AnsweredQuestion> answers;
}
