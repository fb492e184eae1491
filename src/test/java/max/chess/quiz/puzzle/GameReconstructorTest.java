package max.chess.quiz.puzzle;

import max.chess.quiz.TestCorpus;
import max.chess.quiz.corpus.PositionCorpus;
import max.chess.quiz.game.Game;
import max.chess.quiz.game.board.utils.BoardGenerator;
import max.chess.quiz.utils.ColorUtils;
import max.chess.quiz.utils.notations.MoveIOUtils;
import max.chess.quiz.utils.notations.PgnUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GameReconstructorTest {
    private final PositionCorpus corpus = TestCorpus.fixture();
    private final GameReconstructor reconstructor = new GameReconstructor(corpus);

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2})
    public void plyZeroIsTheStartPosition(int gameRef) {
        // When
        PuzzlePosition position = reconstructor.materialize(gameRef, 0);

        // Then
        assertEquals(BoardGenerator.STANDARD_GAME, position.fen());
        assertTrue(position.history().isEmpty());
        assertEquals(ColorUtils.WHITE, position.sideToMove());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2})
    public void eachPlyAppliesTheNextRecordedMove(int gameRef) {
        // Given
        List<String> tokens = PgnUtils.readMoveTokens(corpus.game(gameRef).transcript());

        for(int k = 0; k < tokens.size(); k++) {
            // When
            Game previous = reconstructor.materialize(gameRef, k).game();
            previous.playMove(MoveIOUtils.resolveSan(previous, tokens.get(k)));
            PuzzlePosition next = reconstructor.materialize(gameRef, k + 1);

            // Then
            assertEquals(previous.toFEN(), next.fen(), "ply " + (k + 1));
            assertEquals(k + 1, next.history().size());
            assertEquals(k % 2 == 0 ? ColorUtils.BLACK : ColorUtils.WHITE, next.sideToMove());
        }
    }

    @Test
    public void historyIsWrittenInSan() {
        // When
        PuzzlePosition position = reconstructor.materialize(0, 7);

        // Then
        assertEquals(List.of("e4", "e5", "Bc4", "Nc6", "Qh5", "Nf6", "Qxf7#"), position.history());
        assertEquals(0, position.game().getLegalMovesCount());
    }

    @Test
    public void enPassantAndCastlesAreReplayed() {
        // When
        PuzzlePosition position = reconstructor.materialize(2, 11);

        // Then
        assertEquals("exd6", position.history().get(4));
        assertEquals("rnbq1rk1/ppp1bppp/3p1n2/8/2B5/5N2/PPPP1PPP/RNBQ1RK1 b - - 5 6", position.fen());
    }

    @Test
    public void previewListsTheMovesInBetween() {
        // When
        PreviewPosition preview = reconstructor.preview(1, 10, 3);

        // Then
        assertEquals(7, preview.position().ply());
        assertEquals(List.of("Bxf3", "Qxf3", "dxe5"), preview.moves());
        assertEquals(ColorUtils.BLACK, preview.position().sideToMove());
    }

    @Test
    public void previewIsClampedAtTheStart() {
        // When
        PreviewPosition preview = reconstructor.preview(0, 2, 5);

        // Then
        assertEquals(0, preview.position().ply());
        assertEquals(List.of("e4", "e5"), preview.moves());
    }

    @Test
    public void previewWithoutPlyAheadIsTheScoredPosition() {
        PreviewPosition preview = reconstructor.preview(1, 16, 0);
        assertEquals(reconstructor.materialize(1, 16).fen(), preview.position().fen());
        assertTrue(preview.moves().isEmpty());
    }

    @Test
    public void positionsAreNotSharedBetweenCalls() {
        // Given
        PuzzlePosition position = reconstructor.materialize(1, 4);
        String fen = position.fen();

        // When
        position.game().playMove(position.game().getLegalMoves()[0]);

        // Then
        assertEquals(fen, position.fen());
    }

    @Test
    public void plyBeyondTheGameShouldFail() {
        ReplayException exception = assertThrows(ReplayException.class, () -> reconstructor.materialize(0, 8));
        assertEquals(0, exception.getGameRef());
        assertThrows(ReplayException.class, () -> reconstructor.materialize(0, -1));
    }

    @Test
    public void corruptedTranscriptShouldFail() {
        // Given
        GameReconstructor corrupted = new GameReconstructor(TestCorpus.of(List.of(
                "[Event \"Corrupted\"]\n\n1. e4 e5 2. Ke3 Nc6 *",
                "[Event \"Unbalanced\"]\n\n1. e4 (1. d4 e5 *")));

        // Then
        assertEquals("e4", corrupted.materialize(0, 2).history().get(0));
        ReplayException exception = assertThrows(ReplayException.class, () -> corrupted.materialize(0, 4));
        assertEquals(2, exception.getPly());
        assertThrows(ReplayException.class, () -> corrupted.materialize(1, 1));
    }
}
