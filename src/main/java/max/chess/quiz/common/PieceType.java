package max.chess.quiz.common;

import max.chess.quiz.utils.PieceUtils;

// Convenience view over the PieceUtils byte codes, used at the API boundary
public enum PieceType {
    PAWN('p'), KNIGHT('n'), BISHOP('b'), ROOK('r'), QUEEN('q'), KING('k'), NONE(' ');

    private final char letter;

    PieceType(char letter) {
        this.letter = letter;
    }

    /** Lower-case letter, as used in FEN for black pieces. */
    public char letter() {
        return letter;
    }

    /** Upper-case letter used in SAN, empty for pawns. */
    public String sanLetter() {
        return this == PAWN || this == NONE ? "" : String.valueOf(Character.toUpperCase(letter));
    }

    public byte toBytes() {
        return PieceUtils.fromPieceType(this);
    }

    public static PieceType fromLetter(char letter) {
        return switch (Character.toLowerCase(letter)) {
            case 'p' -> PAWN;
            case 'n' -> KNIGHT;
            case 'b' -> BISHOP;
            case 'r' -> ROOK;
            case 'q' -> QUEEN;
            case 'k' -> KING;
            default -> throw new IllegalArgumentException("Unknown piece letter " + letter);
        };
    }
}
