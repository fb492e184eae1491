package max.chess.quiz.puzzle;

import max.chess.quiz.QuizException;

/** A transcript of the corpus does not parse or one of its moves cannot be played. */
public class ReplayException extends QuizException {
    private final int gameRef;
    private final int ply;

    public ReplayException(int gameRef, int ply, String message, Throwable cause) {
        super("Game " + gameRef + ", ply " + ply + ": " + message, cause);
        this.gameRef = gameRef;
        this.ply = ply;
    }

    public ReplayException(int gameRef, int ply, String message) {
        this(gameRef, ply, message, null);
    }

    public int getGameRef() {
        return gameRef;
    }

    public int getPly() {
        return ply;
    }
}
