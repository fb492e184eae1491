package max.chess.quiz.puzzle;

import max.chess.quiz.QuizException;

/** No weight entry has the requested side to move. Corpus or configuration defect. */
public class EmptyPartitionException extends QuizException {
    public EmptyPartitionException(String message) {
        super(message);
    }
}
