package max.chess.quiz.movegen.utils;

import max.chess.quiz.game.board.Board;
import max.chess.quiz.movegen.pieces.Bishop;
import max.chess.quiz.movegen.pieces.King;
import max.chess.quiz.movegen.pieces.Knight;
import max.chess.quiz.movegen.pieces.Pawn;
import max.chess.quiz.movegen.pieces.Rook;
import max.chess.quiz.utils.ColorUtils;

public final class CheckUtils {

    public static boolean isSquareAttacked(int positionIndex, Board board, int attackerColor) {
        return getAttackersBB(positionIndex, board, attackerColor) != 0L;
    }

    // Pieces of attackerColor attacking positionIndex
    public static long getAttackersBB(int positionIndex, Board board, int attackerColor) {
        final long attackerBB = board.getColorBB(attackerColor);
        final long occupiedSquareBB = board.gameBB;

        // A pawn of attackerColor attacks us if a pawn of ours would attack it from here
        long attackersBB = Pawn.getAttackBB(positionIndex, ColorUtils.switchColor(attackerColor)) & board.pawnBB;
        attackersBB |= Knight.getAttackBB(positionIndex) & board.knightBB;
        attackersBB |= King.getAttackBB(positionIndex) & board.kingBB;
        attackersBB |= Bishop.getAttackBB(positionIndex, occupiedSquareBB) & (board.bishopBB | board.queenBB);
        attackersBB |= Rook.getAttackBB(positionIndex, occupiedSquareBB) & (board.rookBB | board.queenBB);

        return attackersBB & attackerBB;
    }
}
