package max.chess.quiz.puzzle;

import max.chess.quiz.utils.ColorUtils;

public enum Perspective {
    // side to move at the scored position
    MOVER,
    // the other side, as if it had the move
    OPPONENT;

    public int colorFor(int moverColor) {
        return this == MOVER ? moverColor : ColorUtils.switchColor(moverColor);
    }

    public static Perspective of(int color, int moverColor) {
        return color == moverColor ? MOVER : OPPONENT;
    }
}
