package max.chess.quiz.puzzle;

import max.chess.quiz.corpus.PositionCorpus;
import max.chess.quiz.utils.ColorUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Builds puzzles: draws a sampling point, replays the game to it and computes the answers of the
 * requested question types, plus both all-moves answers used by highlights. One load at a time.
 */
public class PuzzleLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(PuzzleLoader.class);

    private final PositionCorpus corpus;
    private final PositionSampler sampler;
    private final GameReconstructor reconstructor;
    private final AnswerEngine answerEngine;
    private final AtomicBoolean loading = new AtomicBoolean(false);

    public PuzzleLoader(PositionCorpus corpus, PositionSampler sampler, GameReconstructor reconstructor,
                        AnswerEngine answerEngine) {
        this.corpus = corpus;
        this.sampler = sampler;
        this.reconstructor = reconstructor;
        this.answerEngine = answerEngine;
    }

    /**
     * @param scoredColor   side to move at the scored position
     * @param plyAhead      half-moves between the preview and the scored position
     * @param questionTypes question types to answer
     * @throws IllegalStateException   if another load is running
     * @throws EmptyPartitionException if no sampling point has {@code scoredColor} to move
     * @throws ReplayException         if the sampled game cannot be replayed
     */
    public Puzzle load(int scoredColor, int plyAhead, Collection<QuestionType> questionTypes) {
        if(!loading.compareAndSet(false, true)) {
            throw new IllegalStateException("A puzzle is already being loaded");
        }
        try {
            SampledPly sampledPly = sampler.sample(corpus.weights(), ColorUtils.isWhite(scoredColor));
            PuzzlePosition scored = reconstructor.materialize(sampledPly.gameRef(), sampledPly.ply());
            if(scored.sideToMove() != scoredColor) {
                throw new ReplayException(sampledPly.gameRef(), sampledPly.ply(),
                        "replayed position does not have the expected side to move");
            }
            PreviewPosition preview = reconstructor.preview(scored, plyAhead);

            Set<QuestionType> toAnswer = new LinkedHashSet<>(questionTypes);
            toAnswer.add(QuestionType.MOVER_ALL_LEGAL);
            toAnswer.add(QuestionType.OPPONENT_ALL_LEGAL);

            Puzzle puzzle = new Puzzle(sampledPly, scored, preview, answerEngine.answerAll(scored.game(), toAnswer));
            LOGGER.debug("Loaded puzzle from game {} at ply {}: {}", sampledPly.gameRef(), sampledPly.ply(), scored.fen());
            return puzzle;
        } finally {
            loading.set(false);
        }
    }

    public AnswerEngine answerEngine() {
        return answerEngine;
    }

    public boolean isLoading() {
        return loading.get();
    }
}
