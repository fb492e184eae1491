package max.chess.quiz.puzzle;

import max.chess.quiz.game.Game;
import max.chess.quiz.movegen.VerboseMove;
import max.chess.quiz.utils.ColorUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts the moves a question asks about. Opponent questions are answered on a copy of the position
 * where the other side has the move, everything else unchanged.
 */
public class AnswerEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnswerEngine.class);

    public AnswerRecord answer(PuzzlePosition position, QuestionType questionType) {
        return answer(position.game(), questionType);
    }

    public AnswerRecord answer(Game position, QuestionType questionType) {
        if(questionType == null) {
            throw new InvalidQuestionTypeException("Question type is missing");
        }

        Game state = switch (questionType.perspective()) {
            case MOVER -> position.copy();
            case OPPONENT -> position.withSideToMove(ColorUtils.switchColor(position.currentPlayer));
        };
        // The flipped side may leave the other king attacked, counts are still given for that state
        boolean degenerate = questionType.perspective() == Perspective.OPPONENT
                && state.isKingAttacked(ColorUtils.switchColor(state.currentPlayer));
        if(degenerate) {
            LOGGER.warn("Counting {} on a flipped position where the side not to move is in check: {}",
                    questionType, state.toFEN());
        }

        List<String> moves = new ArrayList<>();
        List<MoveTarget> targets = new ArrayList<>();
        for(VerboseMove move : VerboseMove.generate(state)) {
            if(counts(questionType.kind(), move)) {
                moves.add(move.san());
                targets.add(new MoveTarget(move.to(), move.piece()));
            }
        }
        return new AnswerRecord(moves.size(), moves, targets, degenerate);
    }

    public Map<QuestionType, AnswerRecord> answerAll(Game position, Collection<QuestionType> questionTypes) {
        Map<QuestionType, AnswerRecord> answers = new LinkedHashMap<>();
        for(QuestionType questionType : questionTypes) {
            answers.computeIfAbsent(questionType, type -> answer(position, type));
        }
        return answers;
    }

    private static boolean counts(QuestionKind kind, VerboseMove move) {
        return switch (kind) {
            case ALL_LEGAL -> true;
            case CHECKS -> move.givesCheck();
            case CAPTURES -> move.capture() || move.enPassant();
        };
    }
}
