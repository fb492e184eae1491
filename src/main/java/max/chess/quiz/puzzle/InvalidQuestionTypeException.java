package max.chess.quiz.puzzle;

import max.chess.quiz.QuizException;

/** A question type outside the closed (perspective, kind) domain. Indicates a programming error. */
public class InvalidQuestionTypeException extends QuizException {
    public InvalidQuestionTypeException(String message) {
        super(message);
    }
}
