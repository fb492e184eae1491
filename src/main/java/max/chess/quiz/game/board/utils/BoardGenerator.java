package max.chess.quiz.game.board.utils;

import max.chess.quiz.game.Game;
import max.chess.quiz.utils.notations.FENUtils;

public class BoardGenerator {
    public static final String STANDARD_GAME = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    public static Game newStandardGameBoard() {
        return from(STANDARD_GAME);
    }

    public static Game from(String fen) {
        return FENUtils.getBoardFrom(fen);
    }
}
