package max.chess.quiz.movegen;

import max.chess.quiz.utils.PieceUtils;

/**
 * Moves are packed in a single int so that move lists stay plain int arrays:
 * <pre>
 *  bits  0-5   end position
 *  bits  6-11  start position
 *  bits 12-14  moving piece type
 *  bits 15-17  promotion piece type
 *  bits 18-20  captured piece type (pawn for en passant)
 *  bits 21-22  flags: en passant, castle king side, castle queen side
 * </pre>
 */
public final class Move {
    private static final int FLAGS_SHIFT = 21;
    private static final int FLAGS_MASK = 0b11 << FLAGS_SHIFT;
    private static final int EN_PASSANT_FLAG = 0b01 << FLAGS_SHIFT;
    private static final int CASTLE_KING_SIDE_FLAG = 0b10 << FLAGS_SHIFT;
    private static final int CASTLE_QUEEN_SIDE_FLAG = 0b11 << FLAGS_SHIFT;

    public static final int CASTLE_KING_SIDE_WHITE_MOVE = Move.asBytes(4, 6, PieceUtils.KING) | CASTLE_KING_SIDE_FLAG;
    public static final int CASTLE_QUEEN_SIDE_WHITE_MOVE = Move.asBytes(4, 2, PieceUtils.KING) | CASTLE_QUEEN_SIDE_FLAG;
    public static final int CASTLE_KING_SIDE_BLACK_MOVE = Move.asBytes(60, 62, PieceUtils.KING) | CASTLE_KING_SIDE_FLAG;
    public static final int CASTLE_QUEEN_SIDE_BLACK_MOVE = Move.asBytes(60, 58, PieceUtils.KING) | CASTLE_QUEEN_SIDE_FLAG;

    private Move() {
    }

    public static int asBytes(final int startPosition, final int endPosition, final byte pieceType) {
        return (pieceType << 12) | (startPosition << 6) | endPosition;
    }

    public static int asBytes(final int startPosition, final int endPosition,
                              final byte pieceType, final byte promotion, final byte pieceEaten) {
        return (pieceEaten << 18) | (promotion << 15) | asBytes(startPosition, endPosition, pieceType);
    }

    public static int asBytesEnPassant(final int startPosition, final int endPosition) {
        return asBytes(startPosition, endPosition, PieceUtils.PAWN, PieceUtils.NONE, PieceUtils.PAWN) | EN_PASSANT_FLAG;
    }

    public static int getStartPosition(final int bytes) {
        return (bytes >>> 6) & 0b111111;
    }

    public static int getEndPosition(final int bytes) {
        return bytes & 0b111111;
    }

    public static byte getPieceType(final int bytes) {
        return (byte) ((bytes >>> 12) & 0b111);
    }

    public static byte getPromotion(final int bytes) {
        return (byte) ((bytes >>> 15) & 0b111);
    }

    public static byte getPieceEaten(final int bytes) {
        return (byte) ((bytes >>> 18) & 0b111);
    }

    public static boolean isCapture(final int bytes) {
        return getPieceEaten(bytes) != PieceUtils.NONE;
    }

    public static boolean isCastleKingSide(final int bytes) {
        return (bytes & FLAGS_MASK) == CASTLE_KING_SIDE_FLAG;
    }

    public static boolean isCastleQueenSide(final int bytes) {
        return (bytes & FLAGS_MASK) == CASTLE_QUEEN_SIDE_FLAG;
    }

    public static boolean isEnPassant(final int bytes) {
        return (bytes & FLAGS_MASK) == EN_PASSANT_FLAG;
    }
}
