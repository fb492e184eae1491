package max.chess.quiz.movegen.pieces;

import max.chess.quiz.utils.BitUtils;

public final class Knight {
    public static final long[] KNIGHT_MOVES_BB = new long[64];

    static {
        generateKnightMovesBB();
    }

    public static long getMovesBB(int positionIndex, long friendlyOccupiedSquareBB) {
        return KNIGHT_MOVES_BB[positionIndex] & ~friendlyOccupiedSquareBB;
    }

    public static long getAttackBB(int positionIndex) {
        return KNIGHT_MOVES_BB[positionIndex];
    }

    private static void generateKnightMovesBB() {
        int[][] jumps = {{1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}};
        for(int i = 0; i < 64; i++) {
            int x = BitUtils.file(i);
            int y = BitUtils.rank(i);
            long movesBB = 0;
            for(int[] jump : jumps) {
                int targetX = x + jump[0];
                int targetY = y + jump[1];
                if(targetX >= 0 && targetX < 8 && targetY >= 0 && targetY < 8) {
                    movesBB |= BitUtils.getPositionIndexBitMask(targetY * 8 + targetX);
                }
            }
            KNIGHT_MOVES_BB[i] = movesBB;
        }
    }
}
