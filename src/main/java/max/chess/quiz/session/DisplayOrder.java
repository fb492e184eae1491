package max.chess.quiz.session;

import max.chess.quiz.puzzle.Perspective;
import max.chess.quiz.puzzle.QuestionKind;
import max.chess.quiz.puzzle.QuestionType;
import max.chess.quiz.utils.ColorUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Questions are always listed White first then Black, and for each side Moves, Checks then Captures,
 * whichever side has the move.
 */
public final class DisplayOrder {
    private static final int[] COLORS = {ColorUtils.WHITE, ColorUtils.BLACK};
    private static final QuestionKind[] KINDS = {QuestionKind.ALL_LEGAL, QuestionKind.CHECKS, QuestionKind.CAPTURES};

    private DisplayOrder() {
    }

    // The active question types, in display order for the given side to move
    public static List<QuestionType> order(Collection<QuestionType> active, int moverColor) {
        List<QuestionType> ordered = new ArrayList<>(active.size());
        for(int color : COLORS) {
            for(QuestionKind kind : KINDS) {
                QuestionType questionType = questionTypeFor(color, kind, moverColor);
                if(active.contains(questionType)) {
                    ordered.add(questionType);
                }
            }
        }
        return ordered;
    }

    public static QuestionType questionTypeFor(int color, QuestionKind kind, int moverColor) {
        return new QuestionType(Perspective.of(color, moverColor), kind);
    }

    public static int colorOf(QuestionType questionType, int moverColor) {
        return questionType.perspective().colorFor(moverColor);
    }

    // "White's Checks"
    public static String label(QuestionType questionType, int moverColor) {
        String who = ColorUtils.isWhite(colorOf(questionType, moverColor)) ? "White's" : "Black's";
        return who + " " + questionType.kind().label();
    }
}
