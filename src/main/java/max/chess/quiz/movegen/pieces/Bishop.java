package max.chess.quiz.movegen.pieces;

import max.chess.quiz.movegen.utils.BitBoardUtils;

public final class Bishop {
    public static long getMovesBB(int positionIndex, long friendlyOccupiedSquareBB, long occupiedSquareBB) {
        return getAttackBB(positionIndex, occupiedSquareBB) & ~friendlyOccupiedSquareBB;
    }

    public static long getAttackBB(int positionIndex, long occupiedSquareBB) {
        return BitBoardUtils.generateRaysAttack(positionIndex, BitBoardUtils.DIAGONALS, occupiedSquareBB);
    }
}
