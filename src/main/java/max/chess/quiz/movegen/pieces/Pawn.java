package max.chess.quiz.movegen.pieces;

import max.chess.quiz.movegen.utils.BitBoardUtils;
import max.chess.quiz.utils.BitUtils;
import max.chess.quiz.utils.ColorUtils;

public final class Pawn {
    public static final long[] BLACK_PAWN_ATTACKING_MOVES_BB = new long[64];
    public static final long[] WHITE_PAWN_ATTACKING_MOVES_BB = new long[64];

    static {
        for(int i = 0; i < 64; i++) {
            long pawnBB = BitUtils.getPositionIndexBitMask(i);
            WHITE_PAWN_ATTACKING_MOVES_BB[i] = BitBoardUtils.shift(pawnBB, BitBoardUtils.Direction.NORTHEAST)
                    | BitBoardUtils.shift(pawnBB, BitBoardUtils.Direction.NORTHWEST);
            BLACK_PAWN_ATTACKING_MOVES_BB[i] = BitBoardUtils.shift(pawnBB, BitBoardUtils.Direction.SOUTHEAST)
                    | BitBoardUtils.shift(pawnBB, BitBoardUtils.Direction.SOUTHWEST);
        }
    }

    public static long getAttackBB(int pawnPosition, int color) {
        return ColorUtils.isWhite(color)
                ? WHITE_PAWN_ATTACKING_MOVES_BB[pawnPosition]
                : BLACK_PAWN_ATTACKING_MOVES_BB[pawnPosition];
    }

    // Single and double pushes, blocked by any piece in front
    public static long getPushesBB(int pawnPosition, int color, long occupiedSquaresBB) {
        int forward = ColorUtils.forward(color);
        int oneStep = pawnPosition + forward;
        if(oneStep < 0 || oneStep > 63 || BitUtils.isSet(occupiedSquaresBB, oneStep)) {
            return 0L;
        }
        long pushesBB = BitUtils.getPositionIndexBitMask(oneStep);
        int startRank = ColorUtils.isWhite(color) ? 1 : 6;
        if(BitUtils.rank(pawnPosition) == startRank) {
            int twoSteps = oneStep + forward;
            if(!BitUtils.isSet(occupiedSquaresBB, twoSteps)) {
                pushesBB |= BitUtils.getPositionIndexBitMask(twoSteps);
            }
        }
        return pushesBB;
    }

    public static boolean isPromotionRank(int positionIndex, int color) {
        return BitUtils.rank(positionIndex) == (ColorUtils.isWhite(color) ? 7 : 0);
    }
}
