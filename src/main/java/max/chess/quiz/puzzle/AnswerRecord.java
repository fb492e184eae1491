package max.chess.quiz.puzzle;

import java.util.List;

/**
 * Ground truth for one question.
 *
 * @param count      number of counted moves
 * @param moves      SAN of the counted moves, in generation order
 * @param targets    landing square and piece of the counted moves, same order, duplicates kept
 * @param degenerate the moves were counted on a flipped position where the side not to move is in check
 */
public record AnswerRecord(int count, List<String> moves, List<MoveTarget> targets, boolean degenerate) {

    public AnswerRecord {
        moves = List.copyOf(moves);
        targets = List.copyOf(targets);
        if(count != moves.size() || count != targets.size()) {
            throw new IllegalArgumentException("count " + count + " does not match " + moves.size()
                    + " moves and " + targets.size() + " targets");
        }
    }
}
