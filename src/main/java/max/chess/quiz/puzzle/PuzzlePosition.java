package max.chess.quiz.puzzle;

import max.chess.quiz.game.Game;

import java.util.List;

/**
 * A position reached by replaying a corpus game.
 *
 * @param gameRef index of the source game
 * @param ply     half-moves replayed
 * @param history SAN of the replayed half-moves
 */
public record PuzzlePosition(Game game, int gameRef, int ply, List<String> history) {

    public PuzzlePosition {
        game = game.copy();
        history = List.copyOf(history);
    }

    // Games are mutable, callers get their own copy
    @Override
    public Game game() {
        return game.copy();
    }

    public int sideToMove() {
        return game.currentPlayer;
    }

    public String fen() {
        return game.toFEN();
    }
}
