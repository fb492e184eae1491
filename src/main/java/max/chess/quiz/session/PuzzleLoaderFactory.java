package max.chess.quiz.session;

import max.chess.quiz.puzzle.PuzzleLoader;

/** Builds the puzzle loader of the corpus named by a configuration. */
@FunctionalInterface
public interface PuzzleLoaderFactory {
    /**
     * @throws max.chess.quiz.corpus.CorpusException if the corpus cannot be loaded
     */
    PuzzleLoader create(QuizConfig config);
}
