package max.chess.quiz.puzzle;

import max.chess.quiz.utils.ColorUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** A loaded puzzle: the scored position, its preview and the answers computed for it. */
public final class Puzzle {
    private final SampledPly sampledPly;
    private final PuzzlePosition scored;
    private final PreviewPosition preview;
    private final Map<QuestionType, AnswerRecord> answers;

    public Puzzle(SampledPly sampledPly, PuzzlePosition scored, PreviewPosition preview,
                  Map<QuestionType, AnswerRecord> answers) {
        this.sampledPly = sampledPly;
        this.scored = scored;
        this.preview = preview;
        this.answers = Collections.unmodifiableMap(new LinkedHashMap<>(answers));
    }

    public SampledPly sampledPly() {
        return sampledPly;
    }

    public PuzzlePosition scored() {
        return scored;
    }

    public PreviewPosition preview() {
        return preview;
    }

    public Map<QuestionType, AnswerRecord> answers() {
        return answers;
    }

    public Optional<AnswerRecord> answer(QuestionType questionType) {
        return Optional.ofNullable(answers.get(questionType));
    }

    // Side to move at the scored position
    public int moverColor() {
        return scored.sideToMove();
    }

    // Side to move on the preview board, which plays the first listed move
    public int previewColor() {
        return preview.position().sideToMove();
    }

    public boolean isMoverWhite() {
        return ColorUtils.isWhite(moverColor());
    }
}
