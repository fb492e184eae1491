package max.chess.quiz.session;

import max.chess.quiz.puzzle.AnswerRecord;
import max.chess.quiz.puzzle.Puzzle;
import max.chess.quiz.puzzle.PuzzleLoader;
import max.chess.quiz.puzzle.QuestionKind;
import max.chess.quiz.puzzle.QuestionType;
import max.chess.quiz.utils.ColorUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.random.RandomGenerator;

/**
 * A timed counting quiz. Each puzzle asks for move counts of the active question types; a puzzle is
 * replaced once all of them are answered right, every wrong answer costs a time penalty and the session
 * ends when the clock runs out or the answers are revealed.
 * <p>
 * All operations are serialized on this instance since ticks come from the scheduler thread.
 */
public class QuizSession {
    private static final Logger LOGGER = LoggerFactory.getLogger(QuizSession.class);

    private final PuzzleLoaderFactory loaderFactory;
    private PuzzleLoader loader;
    private final TickScheduler scheduler;
    private final RandomGenerator random;
    private QuizConfig config;

    private SessionPhase phase = SessionPhase.IDLE;
    private int score = 0;
    private double timeRemaining = 0;
    private TickHandle tickHandle;

    private int previewColor = ColorUtils.WHITE;
    private int scoredColor = ColorUtils.WHITE;
    private Puzzle puzzle;
    private List<QuestionType> activeQuestionTypes = List.of();
    private final Map<QuestionType, AnswerRecord> answers = new LinkedHashMap<>();
    private final Map<QuestionType, Boolean> correctness = new LinkedHashMap<>();
    private HighlightMap highlight;
    private Runnable timeUpListener = () -> {};

    // The corpus stays the same whatever the settings
    public QuizSession(QuizConfig config, PuzzleLoader loader, TickScheduler scheduler, RandomGenerator random) {
        this(config, settings -> loader, scheduler, random);
    }

    /**
     * The loader is built from {@code config} right away and built again whenever new settings name
     * other corpus locations.
     */
    public QuizSession(QuizConfig config, PuzzleLoaderFactory loaderFactory, TickScheduler scheduler, RandomGenerator random) {
        this.config = config;
        this.loaderFactory = loaderFactory;
        this.loader = loaderFactory.create(config);
        this.scheduler = scheduler;
        this.random = random;
    }

    /**
     * Called on the timer thread, with this session locked, when the clock runs out. Ends caused by
     * penalties or reveals are reported by the call that caused them instead.
     */
    public synchronized void onTimeUp(Runnable listener) {
        this.timeUpListener = listener == null ? () -> {} : listener;
    }

    /**
     * Starts a new session: score back to 0, first puzzle loaded, countdown restarted.
     * On failure the session is left idle without a timer.
     */
    public synchronized void start() {
        cancelTimer();
        score = 0;
        puzzle = null;
        phase = SessionPhase.LOADING;

        previewColor = config.sideToMove.resolve(random);
        scoredColor = config.plyAhead % 2 == 0 ? previewColor : ColorUtils.switchColor(previewColor);
        try {
            loadPuzzle();
        } catch (RuntimeException e) {
            LOGGER.error("Cannot start a session", e);
            phase = SessionPhase.IDLE;
            puzzle = null;
            activeQuestionTypes = List.of();
            answers.clear();
            correctness.clear();
            throw e;
        }

        timeRemaining = config.showTimer ? config.timeSeconds : Double.POSITIVE_INFINITY;
        phase = SessionPhase.ACTIVE;
        if(config.showTimer) {
            tickHandle = scheduler.schedule(this::tick);
        }
        LOGGER.info("Session started, {} to move on the preview board, {} to move on the scored position",
                ColorUtils.toColor(previewColor).displayName(), ColorUtils.toColor(scoredColor).displayName());
    }

    /**
     * Settings are read at start, so new ones restart the session. The corpus is reloaded when its
     * locations changed; if that fails the current settings and session are kept.
     *
     * @throws max.chess.quiz.corpus.CorpusException if the new corpus cannot be loaded
     */
    public synchronized void applySettings(QuizConfig newConfig) {
        if(!Objects.equals(newConfig.gamesLocation, config.gamesLocation)
                || !Objects.equals(newConfig.weightsLocation, config.weightsLocation)) {
            LOGGER.info("Corpus locations changed, reloading from {} and {}", newConfig.gamesLocation, newConfig.weightsLocation);
            loader = loaderFactory.create(newConfig);
        }
        this.config = newConfig;
        start();
    }

    public synchronized void tick() {
        if(phase != SessionPhase.ACTIVE || Double.isInfinite(timeRemaining)) {
            return;
        }
        timeRemaining = Math.max(0, timeRemaining - 1);
        if(timeRemaining <= 0) {
            end();
            timeUpListener.run();
        }
    }

    /**
     * Checks the user's raw inputs, as typed. Anything that is not a plain non-negative integer is wrong.
     */
    public synchronized SubmissionResult submitInputs(Map<QuestionType, String> inputs) {
        Map<QuestionType, Integer> counts = new LinkedHashMap<>();
        for(Map.Entry<QuestionType, String> input : inputs.entrySet()) {
            OptionalInt parsed = AnswerParser.parse(input.getValue());
            counts.put(input.getKey(), parsed.isPresent() ? parsed.getAsInt() : null);
        }
        return submit(counts);
    }

    /**
     * Checks the user's counts against every active question. A missing or null count is wrong.
     *
     * @throws IllegalStateException if no puzzle is being played
     */
    public synchronized SubmissionResult submit(Map<QuestionType, Integer> userCounts) {
        if(phase != SessionPhase.ACTIVE) {
            throw new IllegalStateException("Cannot submit while " + phase);
        }

        Map<QuestionType, Boolean> feedback = new LinkedHashMap<>();
        int pointsGained = 0;
        int penalties = 0;
        for(QuestionType questionType : activeQuestionTypes) {
            Integer userCount = userCounts.get(questionType);
            boolean correct = userCount != null && userCount == answers.get(questionType).count();
            feedback.put(questionType, correct);

            if(correct && !correctness.get(questionType)) {
                correctness.put(questionType, true);
                score++;
                pointsGained++;
            }
            if(!correct) {
                // may end the session, remaining questions are still scored
                penalize();
                penalties++;
            }
        }

        if(phase == SessionPhase.ENDED) {
            return new SubmissionResult(feedback, pointsGained, penalties, true, false);
        }
        if(!correctness.containsValue(Boolean.FALSE)) {
            loadNextPuzzle();
            return new SubmissionResult(feedback, pointsGained, penalties, false, true);
        }
        return new SubmissionResult(feedback, pointsGained, penalties, false, false);
    }

    /**
     * Ends the session and exposes every answer.
     *
     * @return false if there was no session to end
     */
    public synchronized boolean reveal() {
        if(phase != SessionPhase.ACTIVE && phase != SessionPhase.LOADING) {
            return false;
        }
        end();
        return true;
    }

    /**
     * Target squares of the moves of one side, computed on demand when the question is not asked.
     *
     * @param color side whose moves are highlighted
     * @throws IllegalStateException if there is no puzzle
     */
    public synchronized HighlightMap highlight(int color, QuestionKind kind) {
        if(puzzle == null) {
            throw new IllegalStateException("No puzzle to highlight");
        }
        QuestionType questionType = DisplayOrder.questionTypeFor(color, kind, scoredColor);
        AnswerRecord answer = answerFor(questionType);
        highlight = new HighlightMap(answer.targets(), color);
        return highlight;
    }

    public synchronized void clearHighlights() {
        highlight = null;
    }

    private AnswerRecord answerFor(QuestionType questionType) {
        AnswerRecord answer = answers.get(questionType);
        if(answer == null) {
            answer = loader.answerEngine().answer(puzzle.scored(), questionType);
            answers.put(questionType, answer);
        }
        return answer;
    }

    private void loadNextPuzzle() {
        phase = SessionPhase.LOADING;
        try {
            loadPuzzle();
        } catch (RuntimeException e) {
            LOGGER.error("Cannot load the next puzzle, ending the session", e);
            end();
            throw e;
        }
        phase = SessionPhase.ACTIVE;
    }

    private void loadPuzzle() {
        Puzzle next = loader.load(scoredColor, config.plyAhead, config.questionTypes);
        puzzle = next;
        answers.clear();
        answers.putAll(next.answers());
        activeQuestionTypes = DisplayOrder.order(config.questionTypes, scoredColor);
        correctness.clear();
        for(QuestionType questionType : activeQuestionTypes) {
            correctness.put(questionType, false);
        }
        highlight = null;
    }

    private void penalize() {
        timeRemaining = Math.max(0, timeRemaining - config.penaltySeconds);
        LOGGER.debug("Wrong answer, {} left", TimeFormat.format(timeRemaining));
        if(timeRemaining <= 0) {
            end();
        }
    }

    private void end() {
        if(phase == SessionPhase.ENDED) {
            return;
        }
        phase = SessionPhase.ENDED;
        cancelTimer();
        LOGGER.info("Session ended with a score of {}", score);
    }

    private void cancelTimer() {
        if(tickHandle != null) {
            tickHandle.cancel();
            tickHandle = null;
        }
    }

    public synchronized SessionPhase phase() {
        return phase;
    }

    public synchronized boolean isEnded() {
        return phase == SessionPhase.ENDED;
    }

    public synchronized int score() {
        return score;
    }

    public synchronized double timeRemaining() {
        return timeRemaining;
    }

    public synchronized boolean hasLiveTimer() {
        return tickHandle != null;
    }

    public synchronized QuizConfig config() {
        return config;
    }

    public synchronized Optional<Puzzle> currentPuzzle() {
        return Optional.ofNullable(puzzle);
    }

    // Active question types in display order
    public synchronized List<QuestionType> activeQuestionTypes() {
        return activeQuestionTypes;
    }

    public synchronized Map<QuestionType, Boolean> correctness() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(correctness));
    }

    public synchronized String label(QuestionType questionType) {
        return DisplayOrder.label(questionType, scoredColor);
    }

    // Answers of the active questions, only once the session has ended
    public synchronized Map<QuestionType, AnswerRecord> revealedAnswers() {
        if(phase != SessionPhase.ENDED || puzzle == null) {
            return Map.of();
        }
        Map<QuestionType, AnswerRecord> revealed = new LinkedHashMap<>();
        for(QuestionType questionType : activeQuestionTypes) {
            revealed.put(questionType, answers.get(questionType));
        }
        return Collections.unmodifiableMap(revealed);
    }

    public synchronized List<MovesTable.Row> movesTable() {
        if(puzzle == null || config.plyAhead == 0) {
            return List.of();
        }
        return MovesTable.of(puzzle.preview().moves(), ColorUtils.isBlack(puzzle.previewColor()));
    }

    public synchronized Optional<HighlightMap> currentHighlight() {
        return Optional.ofNullable(highlight);
    }

    // Side shown to move on the preview board
    public synchronized int previewColor() {
        return previewColor;
    }

    // Side to move on the scored position
    public synchronized int moverColor() {
        return scoredColor;
    }
}
