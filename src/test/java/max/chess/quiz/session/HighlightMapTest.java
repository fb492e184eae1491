package max.chess.quiz.session;

import max.chess.quiz.common.PieceType;
import max.chess.quiz.puzzle.MoveTarget;
import max.chess.quiz.utils.ColorUtils;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HighlightMapTest {

    @Test
    public void targetsAreGroupedBySquareAndPiece() {
        // Given
        List<MoveTarget> targets = List.of(
                new MoveTarget(18, PieceType.KNIGHT), new MoveTarget(16, PieceType.PAWN),
                new MoveTarget(16, PieceType.KNIGHT), new MoveTarget(18, PieceType.KNIGHT));

        // When
        HighlightMap highlight = new HighlightMap(targets, ColorUtils.WHITE);

        // Then
        assertEquals(Set.of(16, 18), highlight.squares());
        assertEquals(Set.of(PieceType.PAWN, PieceType.KNIGHT), highlight.pieces(16));
        assertEquals(Optional.empty(), highlight.singlePiece(16));
        assertEquals(Optional.of(PieceType.KNIGHT), highlight.singlePiece(18));
        assertEquals(2, highlight.count(18, PieceType.KNIGHT));
        assertTrue(highlight.isDuplicate(18, PieceType.KNIGHT));
        assertFalse(highlight.isDuplicate(16, PieceType.KNIGHT));
        assertEquals("a3: P N, c3: Nx2", highlight.toString());
    }

    @Test
    public void noTargetsGiveAnEmptyMap() {
        HighlightMap highlight = new HighlightMap(List.of(), ColorUtils.BLACK);
        assertTrue(highlight.isEmpty());
        assertTrue(highlight.pieces(0).isEmpty());
        assertEquals(0, highlight.count(0, PieceType.PAWN));
        assertEquals("", highlight.toString());
    }
}
