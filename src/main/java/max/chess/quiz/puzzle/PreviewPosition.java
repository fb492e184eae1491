package max.chess.quiz.puzzle;

import java.util.List;

/**
 * The position shown to the user, some half-moves before the scored one.
 *
 * @param position position to display
 * @param moves    SAN of the half-moves leading from it to the scored position
 */
public record PreviewPosition(PuzzlePosition position, List<String> moves) {

    public PreviewPosition {
        moves = List.copyOf(moves);
    }
}
