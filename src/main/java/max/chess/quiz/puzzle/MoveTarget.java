package max.chess.quiz.puzzle;

import max.chess.quiz.common.PieceType;
import max.chess.quiz.utils.notations.MoveIOUtils;

/** Square a counted move lands on, with the kind of piece moving there. */
public record MoveTarget(int square, PieceType piece) {

    public String squareName() {
        return MoveIOUtils.getSquareFromPosition(square);
    }

    @Override
    public String toString() {
        return piece.letter() + "@" + squareName();
    }
}
