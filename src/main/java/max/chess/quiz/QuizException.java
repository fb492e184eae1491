package max.chess.quiz;

// Root of the failures a quiz session can surface
public class QuizException extends RuntimeException {
    public QuizException(String message) {
        super(message);
    }

    public QuizException(String message, Throwable cause) {
        super(message, cause);
    }
}
