package max.chess.quiz.session;

import max.chess.quiz.puzzle.QuestionKind;
import max.chess.quiz.puzzle.QuestionType;
import max.chess.quiz.utils.ColorUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class DisplayOrderTest {

    @Test
    public void whiteToMoveListsMoverQuestionsFirst() {
        // When
        List<QuestionType> ordered = DisplayOrder.order(QuestionType.ALL, ColorUtils.WHITE);

        // Then
        assertEquals(List.of(
                QuestionType.MOVER_ALL_LEGAL, QuestionType.MOVER_CHECKS, QuestionType.MOVER_CAPTURES,
                QuestionType.OPPONENT_ALL_LEGAL, QuestionType.OPPONENT_CHECKS, QuestionType.OPPONENT_CAPTURES), ordered);
    }

    @Test
    public void blackToMoveListsOpponentQuestionsFirst() {
        // When
        List<QuestionType> ordered = DisplayOrder.order(
                List.of(QuestionType.MOVER_CAPTURES, QuestionType.MOVER_CHECKS, QuestionType.OPPONENT_CHECKS),
                ColorUtils.BLACK);

        // Then
        assertEquals(List.of(QuestionType.OPPONENT_CHECKS, QuestionType.MOVER_CHECKS, QuestionType.MOVER_CAPTURES), ordered);
        assertEquals(List.of("White's Checks", "Black's Checks", "Black's Captures"),
                ordered.stream().map(questionType -> DisplayOrder.label(questionType, ColorUtils.BLACK)).toList());
    }

    @Test
    public void colorsMapToPerspectives() {
        assertEquals(QuestionType.OPPONENT_ALL_LEGAL, DisplayOrder.questionTypeFor(ColorUtils.WHITE, QuestionKind.ALL_LEGAL, ColorUtils.BLACK));
        assertEquals(QuestionType.MOVER_CAPTURES, DisplayOrder.questionTypeFor(ColorUtils.BLACK, QuestionKind.CAPTURES, ColorUtils.BLACK));
        assertEquals(ColorUtils.BLACK, DisplayOrder.colorOf(QuestionType.OPPONENT_CHECKS, ColorUtils.WHITE));
        assertEquals("White's Moves", DisplayOrder.label(QuestionType.MOVER_ALL_LEGAL, ColorUtils.WHITE));
    }
}
