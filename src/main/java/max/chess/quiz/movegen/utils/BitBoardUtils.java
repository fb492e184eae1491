package max.chess.quiz.movegen.utils;

import max.chess.quiz.utils.BitUtils;

public final class BitBoardUtils {

    public enum Direction {
        NORTH, SOUTH, EAST, WEST, NORTHEAST, NORTHWEST, SOUTHEAST, SOUTHWEST
    }

    public static final Direction[] ORTHOGONALS = {Direction.NORTH, Direction.SOUTH, Direction.EAST, Direction.WEST};
    public static final Direction[] DIAGONALS = {Direction.NORTHEAST, Direction.NORTHWEST, Direction.SOUTHEAST, Direction.SOUTHWEST};

    /**
     * The bitboards representing the ranks on a chessboard. Bitboard at index 0
     * identifies the 1st rank on a board, bitboard at index 1 the 2nd rank, etc.
     */
    public final static long[] rankBB = { 0x00000000000000FFL, 0x000000000000FF00L, 0x0000000000FF0000L, 0x00000000FF000000L,
            0x000000FF00000000L, 0x0000FF0000000000L, 0x00FF000000000000L, 0xFF00000000000000L };
    /**
     * The bitboards representing the files on a chessboard. Bitboard at index 0
     * identifies the 1st file on a board, bitboard at index 1 the 2nd file, etc.
     */
    public final static long[] fileBB = { 0x0101010101010101L, 0x0202020202020202L, 0x0404040404040404L, 0x0808080808080808L,
            0x1010101010101010L, 0x2020202020202020L, 0x4040404040404040L, 0x8080808080808080L };

    // Squares reached from positionIndex walking towards direction, up to and including the first occupied square
    public static long generateRayAttack(int positionIndex, Direction direction, long occ) {
        long attack = 0L;
        long sqBB = BitUtils.getPositionIndexBitMask(positionIndex);

        while (true) {
            sqBB = shift(sqBB, direction);
            attack |= sqBB;

            if (sqBB == 0 || 0L != (attack & occ)) {
                break;
            }
        }

        return attack;
    }

    public static long generateRaysAttack(int positionIndex, Direction[] directions, long occ) {
        long attack = 0L;
        for (Direction direction : directions) {
            attack |= generateRayAttack(positionIndex, direction, occ);
        }
        return attack;
    }

    public static long shift(long bitboard, Direction direction) {
        return switch (direction) {
            case NORTH -> bitboard << 8;
            case SOUTH -> bitboard >>> 8;
            case EAST -> (bitboard & ~fileBB[7]) << 1;
            case WEST -> (bitboard & ~fileBB[0]) >>> 1;
            case NORTHEAST -> (bitboard & ~fileBB[7]) << 9;
            case NORTHWEST -> (bitboard & ~fileBB[0]) << 7;
            case SOUTHEAST -> (bitboard & ~fileBB[7]) >>> 7;
            case SOUTHWEST -> (bitboard & ~fileBB[0]) >>> 9;
        };
    }
}
