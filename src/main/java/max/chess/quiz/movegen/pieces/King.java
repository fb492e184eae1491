package max.chess.quiz.movegen.pieces;

import max.chess.quiz.utils.BitUtils;

public final class King {
    public static final long[] KING_MOVES_BB = new long[64];

    static {
        for(int i = 0; i < 64; i++) {
            int x = BitUtils.file(i);
            int y = BitUtils.rank(i);
            long movesBB = 0;
            for(int dx = -1; dx <= 1; dx++) {
                for(int dy = -1; dy <= 1; dy++) {
                    int targetX = x + dx;
                    int targetY = y + dy;
                    if((dx != 0 || dy != 0) && targetX >= 0 && targetX < 8 && targetY >= 0 && targetY < 8) {
                        movesBB |= BitUtils.getPositionIndexBitMask(targetY * 8 + targetX);
                    }
                }
            }
            KING_MOVES_BB[i] = movesBB;
        }
    }

    public static long getMovesBB(int positionIndex, long friendlyOccupiedSquareBB) {
        return KING_MOVES_BB[positionIndex] & ~friendlyOccupiedSquareBB;
    }

    public static long getAttackBB(int positionIndex) {
        return KING_MOVES_BB[positionIndex];
    }
}
