package max.chess.quiz.corpus;

import max.chess.quiz.QuizException;

/** The game corpus or the weight index could not be loaded. Fatal to session start. */
public class CorpusException extends QuizException {
    public CorpusException(String message) {
        super(message);
    }

    public CorpusException(String message, Throwable cause) {
        super(message, cause);
    }
}
