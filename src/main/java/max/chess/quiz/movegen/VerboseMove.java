package max.chess.quiz.movegen;

import max.chess.quiz.common.PieceType;
import max.chess.quiz.game.Game;
import max.chess.quiz.utils.PieceUtils;
import max.chess.quiz.utils.notations.MoveIOUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A legal move together with the details needed to classify and display it.
 *
 * @param move       packed move, see {@link Move}
 * @param from       start square index
 * @param to         end square index
 * @param piece      kind of the moving piece
 * @param san        standard algebraic notation, check suffix included
 * @param capture    standard or en passant capture
 * @param enPassant  en passant capture
 * @param givesCheck the side receiving the move is in check once it is played
 */
public record VerboseMove(int move, int from, int to, PieceType piece, String san,
                          boolean capture, boolean enPassant, boolean givesCheck) {

    // Every legal move of the side to move, in generation order
    public static List<VerboseMove> generate(Game game) {
        int[] legalMoves = game.getLegalMoves();
        List<VerboseMove> verboseMoves = new ArrayList<>(legalMoves.length);
        for(int move : legalMoves) {
            Game after = game.copy();
            after.playMove(move);
            verboseMoves.add(new VerboseMove(
                    move,
                    Move.getStartPosition(move),
                    Move.getEndPosition(move),
                    PieceUtils.toPieceType(Move.getPieceType(move)),
                    MoveIOUtils.writeSan(game, move, legalMoves, after),
                    Move.isCapture(move),
                    Move.isEnPassant(move),
                    after.inCheck()));
        }
        return Collections.unmodifiableList(verboseMoves);
    }
}
