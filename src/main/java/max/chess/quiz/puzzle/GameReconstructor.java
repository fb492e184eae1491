package max.chess.quiz.puzzle;

import max.chess.quiz.corpus.PositionCorpus;
import max.chess.quiz.game.Game;
import max.chess.quiz.game.board.utils.BoardGenerator;
import max.chess.quiz.utils.notations.MoveIOUtils;
import max.chess.quiz.utils.notations.PgnUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rebuilds positions of corpus games by replaying their moves from the standard start position.
 * Parsed move lists are cached per game since the corpus never changes.
 */
public class GameReconstructor {
    private static final Logger LOGGER = LoggerFactory.getLogger(GameReconstructor.class);

    private final PositionCorpus corpus;
    private final Map<Integer, List<String>> tokensByGame = new ConcurrentHashMap<>();

    public GameReconstructor(PositionCorpus corpus) {
        this.corpus = corpus;
    }

    /**
     * Plays the first {@code ply} recorded half-moves of a game.
     *
     * @throws ReplayException if the transcript does not parse, is shorter than {@code ply}
     *                         or holds a move that cannot be played
     */
    public PuzzlePosition materialize(int gameRef, int ply) {
        if(ply < 0) {
            throw new ReplayException(gameRef, ply, "negative ply");
        }
        List<String> tokens = tokens(gameRef);
        if(ply > tokens.size()) {
            throw new ReplayException(gameRef, ply, "game only has " + tokens.size() + " half-moves");
        }

        Game game = BoardGenerator.newStandardGameBoard();
        List<String> history = new ArrayList<>(ply);
        for(int i = 0; i < ply; i++) {
            String token = tokens.get(i);
            int move;
            try {
                move = MoveIOUtils.resolveSan(game, token);
            } catch (IllegalArgumentException e) {
                LOGGER.error("Cannot replay move {} '{}' of game {}", i + 1, token, gameRef, e);
                throw new ReplayException(gameRef, i, "cannot play '" + token + "'", e);
            }
            int[] legalMoves = game.getLegalMoves();
            Game after = game.copy();
            after.playMove(move);
            history.add(MoveIOUtils.writeSan(game, move, legalMoves, after));
            game = after;
        }
        return new PuzzlePosition(game, gameRef, ply, history);
    }

    /**
     * The position {@code plyAhead} half-moves before {@code ply}, clamped at the start of the game,
     * with the moves leading from it to {@code ply}.
     */
    public PreviewPosition preview(int gameRef, int ply, int plyAhead) {
        PuzzlePosition scored = materialize(gameRef, ply);
        return preview(scored, plyAhead);
    }

    public PreviewPosition preview(PuzzlePosition scored, int plyAhead) {
        if(plyAhead < 0) {
            throw new IllegalArgumentException("plyAhead must not be negative, got " + plyAhead);
        }
        int previewPly = Math.max(0, scored.ply() - plyAhead);
        PuzzlePosition previewPosition = materialize(scored.gameRef(), previewPly);
        return new PreviewPosition(previewPosition, scored.history().subList(previewPly, scored.ply()));
    }

    public int length(int gameRef) {
        return tokens(gameRef).size();
    }

    private List<String> tokens(int gameRef) {
        return tokensByGame.computeIfAbsent(gameRef, this::parse);
    }

    private List<String> parse(int gameRef) {
        String transcript = corpus.game(gameRef).transcript();
        try {
            return List.copyOf(PgnUtils.readMoveTokens(transcript));
        } catch (IllegalArgumentException e) {
            LOGGER.error("Cannot parse transcript of game {}", gameRef, e);
            throw new ReplayException(gameRef, 0, "transcript does not parse", e);
        }
    }
}
