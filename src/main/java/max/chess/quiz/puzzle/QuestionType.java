package max.chess.quiz.puzzle;

import java.util.List;
import java.util.Locale;

/**
 * What a question counts: the moves of one side, restricted to one kind.
 * Text form is {@code <PERSPECTIVE>_<KIND>}, for instance {@code OPPONENT_CAPTURES}.
 */
public record QuestionType(Perspective perspective, QuestionKind kind) {
    public static final QuestionType MOVER_ALL_LEGAL = new QuestionType(Perspective.MOVER, QuestionKind.ALL_LEGAL);
    public static final QuestionType MOVER_CHECKS = new QuestionType(Perspective.MOVER, QuestionKind.CHECKS);
    public static final QuestionType MOVER_CAPTURES = new QuestionType(Perspective.MOVER, QuestionKind.CAPTURES);
    public static final QuestionType OPPONENT_ALL_LEGAL = new QuestionType(Perspective.OPPONENT, QuestionKind.ALL_LEGAL);
    public static final QuestionType OPPONENT_CHECKS = new QuestionType(Perspective.OPPONENT, QuestionKind.CHECKS);
    public static final QuestionType OPPONENT_CAPTURES = new QuestionType(Perspective.OPPONENT, QuestionKind.CAPTURES);

    public static final List<QuestionType> ALL = List.of(
            MOVER_ALL_LEGAL, MOVER_CHECKS, MOVER_CAPTURES,
            OPPONENT_ALL_LEGAL, OPPONENT_CHECKS, OPPONENT_CAPTURES);

    public QuestionType {
        if(perspective == null || kind == null) {
            throw new InvalidQuestionTypeException("Question type needs a perspective and a kind, got "
                    + perspective + "/" + kind);
        }
    }

    public static QuestionType parse(String token) {
        String normalized = token == null ? "" : token.trim().toUpperCase(Locale.ROOT);
        for(QuestionType questionType : ALL) {
            if(questionType.toString().equals(normalized)) {
                return questionType;
            }
        }
        throw new InvalidQuestionTypeException("Unknown question type '" + token + "'");
    }

    @Override
    public String toString() {
        return perspective.name() + "_" + kind.name();
    }
}
