package max.chess.quiz.utils;

import max.chess.quiz.common.PieceType;

public final class PieceUtils {
    private static final byte PIECE_TYPE_MASK = 0b0000111;

    public static final byte NONE = 0;
    public static final byte PAWN = 1;
    public static final byte KNIGHT = 2;
    public static final byte BISHOP = 3;
    public static final byte ROOK = 4;
    public static final byte QUEEN = 5;
    public static final byte KING = 6;

    // Order in which promotion moves are generated
    public static final byte[] PROMOTIONS = {QUEEN, ROOK, BISHOP, KNIGHT};

    // static prebuilt table (index 0..6)
    static final PieceType[] FROM_CODE = {
            PieceType.NONE, PieceType.PAWN, PieceType.KNIGHT,
            PieceType.BISHOP, PieceType.ROOK, PieceType.QUEEN, PieceType.KING
    };

    public static PieceType toPieceType(int code) {
        return FROM_CODE[code & PIECE_TYPE_MASK];
    }

    public static byte fromPieceType(PieceType pieceType) {
        return switch (pieceType) {
            case PAWN -> PAWN;
            case KNIGHT -> KNIGHT;
            case BISHOP -> BISHOP;
            case ROOK -> ROOK;
            case QUEEN -> QUEEN;
            case KING -> KING;
            case NONE -> NONE;
        };
    }

    public static byte toPieceCode(int code) {
        return (byte) (code & PIECE_TYPE_MASK);
    }
}
