package max.chess.quiz.utils;

import max.chess.quiz.common.Color;

public final class ColorUtils {
    public static final int BLACK = -1;
    public static final int WHITE = 1;

    public static int switchColor(int color) {
        return ~color + 1;
    }

    public static boolean isBlack(int color) {
        return color == BLACK;
    }

    public static boolean isWhite(int color) {
        return color == WHITE;
    }

    public static int fromColor(Color color) {
        return color == Color.WHITE ? WHITE : BLACK;
    }

    public static Color toColor(int color) {
        return isWhite(color) ? Color.WHITE : Color.BLACK;
    }

    // Pawn push direction on the square index
    public static int forward(int color) {
        return isWhite(color) ? 8 : -8;
    }
}
