package max.chess.quiz.session;

import max.chess.quiz.puzzle.QuestionType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one submission.
 *
 * @param feedback         correctness of every active question, in display order
 * @param pointsGained     questions answered right for the first time
 * @param penaltiesApplied wrong answers, each costing the configured penalty
 * @param ended            the session is over, possibly because of this submission's penalties
 * @param nextPuzzleLoaded every question was right and a new puzzle replaced this one
 */
public record SubmissionResult(Map<QuestionType, Boolean> feedback, int pointsGained, int penaltiesApplied,
                               boolean ended, boolean nextPuzzleLoaded) {

    public SubmissionResult {
        feedback = Collections.unmodifiableMap(new LinkedHashMap<>(feedback));
    }

    public boolean allCorrect() {
        return !feedback.containsValue(Boolean.FALSE);
    }
}
