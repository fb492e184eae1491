package max.chess.quiz.puzzle;

import max.chess.quiz.TestCorpus;
import max.chess.quiz.corpus.PositionCorpus;
import max.chess.quiz.corpus.WeightEntry;
import max.chess.quiz.utils.ColorUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PuzzleLoaderTest {

    @ParameterizedTest
    @ValueSource(ints = {ColorUtils.WHITE, ColorUtils.BLACK})
    public void scoredPositionHasTheRequestedSideToMove(int scoredColor) {
        // Given
        PuzzleLoader loader = loader(TestCorpus.fixture(), 11);

        for(int i = 0; i < 20; i++) {
            // When
            Puzzle puzzle = loader.load(scoredColor, 0, List.of(QuestionType.MOVER_CHECKS));

            // Then
            assertEquals(scoredColor, puzzle.moverColor());
            assertEquals(scoredColor, puzzle.previewColor());
            assertEquals(ColorUtils.isWhite(scoredColor), puzzle.sampledPly().ply() % 2 == 0);
            assertEquals(puzzle.scored().fen(), puzzle.preview().position().fen());
            assertTrue(puzzle.preview().moves().isEmpty());
        }
    }

    @Test
    public void answersIncludeBothMoveCounts() {
        // Given
        PuzzleLoader loader = loader(TestCorpus.of(List.of(TestCorpus.SCHOLARS_MATE), new WeightEntry(0, 4, 1)), 3);

        // When
        Puzzle puzzle = loader.load(ColorUtils.WHITE, 0, List.of(QuestionType.OPPONENT_CAPTURES, QuestionType.MOVER_CHECKS));

        // Then
        assertEquals(List.of(QuestionType.OPPONENT_CAPTURES, QuestionType.MOVER_CHECKS,
                QuestionType.MOVER_ALL_LEGAL, QuestionType.OPPONENT_ALL_LEGAL), List.copyOf(puzzle.answers().keySet()));
        assertTrue(puzzle.answer(QuestionType.MOVER_ALL_LEGAL).isPresent());
        assertFalse(puzzle.answer(QuestionType.MOVER_CAPTURES).isPresent());
        // 1. e4 e5 2. Bc4 Nc6
        assertEquals(List.of("e4", "e5", "Bc4", "Nc6"), puzzle.scored().history());
        assertTrue(puzzle.isMoverWhite());
    }

    @Test
    public void previewStartsPlyAheadEarlier() {
        // Given
        PuzzleLoader loader = loader(TestCorpus.of(List.of(TestCorpus.OPERA_GAME), new WeightEntry(0, 21, 1)), 5);

        // When
        Puzzle puzzle = loader.load(ColorUtils.BLACK, 3, List.of(QuestionType.MOVER_CAPTURES));

        // Then
        assertEquals(18, puzzle.preview().position().ply());
        assertEquals(List.of("Nxb5", "cxb5", "Bxb5+"), puzzle.preview().moves());
        assertEquals(ColorUtils.WHITE, puzzle.previewColor());
        assertEquals(ColorUtils.BLACK, puzzle.moverColor());
    }

    @Test
    public void missingSideShouldFail() {
        // Given
        PuzzleLoader loader = loader(TestCorpus.of(List.of(TestCorpus.SCHOLARS_MATE), new WeightEntry(0, 4, 1)), 1);

        // Then
        assertThrows(EmptyPartitionException.class, () -> loader.load(ColorUtils.BLACK, 0, List.of(QuestionType.MOVER_CHECKS)));
        assertFalse(loader.isLoading());
    }

    @Test
    public void weightBeyondTheGameShouldFail() {
        // Given
        PuzzleLoader loader = loader(TestCorpus.of(List.of(TestCorpus.SCHOLARS_MATE), new WeightEntry(0, 40, 1)), 1);

        // Then
        assertThrows(ReplayException.class, () -> loader.load(ColorUtils.WHITE, 0, List.of(QuestionType.MOVER_CHECKS)));
        assertFalse(loader.isLoading());
    }

    @Test
    public void onlyOneLoadAtATime() {
        // Given
        PositionCorpus corpus = TestCorpus.of(List.of(TestCorpus.SCHOLARS_MATE), new WeightEntry(0, 4, 1));
        AtomicReference<PuzzleLoader> loaderRef = new AtomicReference<>();
        AtomicReference<RuntimeException> nestedFailure = new AtomicReference<>();
        PositionSampler reentrantSampler = new PositionSampler(new Random(1)) {
            @Override
            public SampledPly sample(List<WeightEntry> weightIndex, boolean requireWhiteToMove) {
                try {
                    loaderRef.get().load(ColorUtils.WHITE, 0, List.of(QuestionType.MOVER_CHECKS));
                } catch (RuntimeException e) {
                    nestedFailure.set(e);
                }
                return super.sample(weightIndex, requireWhiteToMove);
            }
        };
        PuzzleLoader loader = new PuzzleLoader(corpus, reentrantSampler, new GameReconstructor(corpus), new AnswerEngine());
        loaderRef.set(loader);

        // When
        Puzzle puzzle = loader.load(ColorUtils.WHITE, 0, List.of(QuestionType.MOVER_CHECKS));

        // Then
        assertEquals(4, puzzle.sampledPly().ply());
        assertInstanceOf(IllegalStateException.class, nestedFailure.get());
        assertFalse(loader.isLoading());
    }

    private static PuzzleLoader loader(PositionCorpus corpus, long seed) {
        return new PuzzleLoader(corpus, new PositionSampler(new Random(seed)), new GameReconstructor(corpus), new AnswerEngine());
    }
}
