package max.chess.quiz.session;

import max.chess.quiz.utils.ColorUtils;

import java.util.random.RandomGenerator;

/** Which side is shown to move on the preview board. */
public enum SideToMoveMode {
    WHITE,
    BLACK,
    RANDOM;

    public int resolve(RandomGenerator random) {
        return switch (this) {
            case WHITE -> ColorUtils.WHITE;
            case BLACK -> ColorUtils.BLACK;
            case RANDOM -> random.nextDouble() < .5 ? ColorUtils.WHITE : ColorUtils.BLACK;
        };
    }
}
