package max.chess.quiz.console;

import max.chess.quiz.QuizException;
import max.chess.quiz.game.Game;
import max.chess.quiz.puzzle.AnswerRecord;
import max.chess.quiz.puzzle.Puzzle;
import max.chess.quiz.puzzle.QuestionKind;
import max.chess.quiz.puzzle.QuestionType;
import max.chess.quiz.session.HighlightMap;
import max.chess.quiz.session.MovesTable;
import max.chess.quiz.session.QuizConfig;
import max.chess.quiz.session.QuizSession;
import max.chess.quiz.session.SessionPhase;
import max.chess.quiz.session.SubmissionResult;
import max.chess.quiz.session.TimeFormat;
import max.chess.quiz.utils.ColorUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Line based front end of a quiz session. Run the loop with {@link #run()}, type {@code help} for the commands.
 */
public final class QuizConsole {
    private static final Logger LOGGER = LoggerFactory.getLogger(QuizConsole.class);

    private final QuizSession session;
    private final BufferedReader in;
    private final PrintWriter out;

    public QuizConsole(QuizSession session, BufferedReader in, PrintWriter out) {
        this.session = Objects.requireNonNull(session);
        this.in = Objects.requireNonNull(in);
        this.out = Objects.requireNonNull(out);
        session.onTimeUp(this::timeUp);
    }

    public void run() {
        send("Chess count quiz. Type 'help' for the commands.");
        newSession();
        try {
            String line;
            while((line = in.readLine()) != null) {
                line = line.trim();
                if(line.isEmpty()) continue;
                if(!handle(line)) {
                    break;
                }
            }
        } catch (IOException e) {
            LOGGER.warn("Input closed", e);
        }
    }

    // Returns false once the user asked to quit
    boolean handle(String line) {
        String[] tokens = line.split("\\s+");
        String command = tokens[0].toLowerCase(Locale.ROOT);
        switch (command) {
            case "new" -> newSession();
            case "show" -> show();
            case "submit" -> submit(tokens);
            case "reveal" -> reveal();
            case "highlight" -> highlight(tokens);
            case "clear" -> {
                session.clearHighlights();
                send("Highlights cleared");
            }
            case "settings" -> settings();
            case "set" -> set(tokens);
            case "help" -> help();
            case "quit", "exit" -> {
                return false;
            }
            default -> send("Unknown command '" + tokens[0] + "', type 'help'");
        }
        return true;
    }

    private void newSession() {
        try {
            session.start();
            show();
        } catch (QuizException e) {
            send("Cannot start a quiz: " + e.getMessage());
        }
    }

    private void show() {
        Puzzle puzzle = session.currentPuzzle().orElse(null);
        if(puzzle == null) {
            send("No puzzle, type 'new' to start");
            return;
        }
        Game preview = puzzle.preview().position().game();
        boolean flipped = ColorUtils.isBlack(session.previewColor());
        send(Game.boardAscii(preview, flipped));
        send(ColorUtils.toColor(preview.currentPlayer).displayName() + " to move");

        List<MovesTable.Row> rows = session.movesTable();
        if(!rows.isEmpty()) {
            send("Compute counts after these moves:");
            out.print(MovesTable.render(rows));
        }
        send("Score: " + session.score() + "   Time: " + TimeFormat.format(session.timeRemaining()));

        Map<QuestionType, Boolean> correctness = session.correctness();
        int index = 1;
        for(QuestionType questionType : session.activeQuestionTypes()) {
            String mark = Boolean.TRUE.equals(correctness.get(questionType)) ? " ✓" : "";
            send("  " + index++ + ". " + session.label(questionType) + mark);
        }
        send("submit <n...> answers in that order");
        if(session.phase() == SessionPhase.ENDED) {
            printAnswers();
        }
    }

    private void submit(String[] tokens) {
        if(session.phase() != SessionPhase.ACTIVE) {
            send("No running quiz, type 'new' to start");
            return;
        }
        List<QuestionType> questionTypes = session.activeQuestionTypes();
        Map<QuestionType, String> inputs = new LinkedHashMap<>();
        for(int i = 0; i < questionTypes.size(); i++) {
            inputs.put(questionTypes.get(i), i + 1 < tokens.length ? tokens[i + 1] : "");
        }

        SubmissionResult result;
        try {
            result = session.submitInputs(inputs);
        } catch (IllegalStateException e) {
            // the clock ran out after the phase check, the time up message has been printed
            send("Too late, the quiz is over");
            return;
        } catch (QuizException e) {
            send("Cannot load the next puzzle: " + e.getMessage());
            return;
        }
        for(Map.Entry<QuestionType, Boolean> feedback : result.feedback().entrySet()) {
            send("  " + (feedback.getValue() ? "✓ " : "✗ ") + session.label(feedback.getKey()));
        }
        if(result.ended()) {
            send("Time is up! Final score: " + session.score());
            printAnswers();
        } else if(result.nextPuzzleLoaded()) {
            send("All correct, next puzzle");
            show();
        } else {
            send("Score: " + session.score() + "   Time: " + TimeFormat.format(session.timeRemaining()));
        }
    }

    // Timer thread, the session is locked
    private void timeUp() {
        send("");
        send("Time is up! Final score: " + session.score());
        printAnswers();
    }

    private void settings() {
        Properties properties = session.config().toProperties();
        for(String key : QuizConfig.KEYS) {
            send(key + "=" + properties.getProperty(key));
        }
    }

    private void set(String[] tokens) {
        if(tokens.length != 3) {
            send("Usage: set <key> <value>, type 'settings' for the keys");
            return;
        }
        QuizConfig newConfig;
        try {
            newConfig = session.config().with(tokens[1], tokens[2]);
        } catch (IllegalArgumentException e) {
            send("Invalid setting: " + e.getMessage());
            return;
        }
        try {
            session.applySettings(newConfig);
        } catch (QuizException e) {
            send("Cannot apply the settings: " + e.getMessage());
            return;
        }
        send("Settings applied, new quiz started");
        show();
    }

    private void reveal() {
        if(!session.reveal()) {
            send("Nothing to reveal");
            return;
        }
        send("Final score: " + session.score());
        printAnswers();
    }

    private void printAnswers() {
        for(Map.Entry<QuestionType, AnswerRecord> answer : session.revealedAnswers().entrySet()) {
            AnswerRecord record = answer.getValue();
            String moves = record.moves().isEmpty() ? "" : " (" + String.join(", ", record.moves()) + ")";
            send("  " + session.label(answer.getKey()) + ": " + record.count() + moves);
        }
    }

    private void highlight(String[] tokens) {
        if(tokens.length != 3) {
            send("Usage: highlight <white|black> <moves|checks|captures>");
            return;
        }
        int color = switch (tokens[1].toLowerCase(Locale.ROOT)) {
            case "white" -> ColorUtils.WHITE;
            case "black" -> ColorUtils.BLACK;
            default -> 0;
        };
        if(color == 0) {
            send("Unknown side '" + tokens[1] + "'");
            return;
        }
        QuestionKind kind = switch (tokens[2].toLowerCase(Locale.ROOT)) {
            case "moves" -> QuestionKind.ALL_LEGAL;
            case "checks" -> QuestionKind.CHECKS;
            case "captures" -> QuestionKind.CAPTURES;
            default -> null;
        };
        if(kind == null) {
            send("Unknown kind '" + tokens[2] + "'");
            return;
        }
        if(session.currentPuzzle().isEmpty()) {
            send("No puzzle to highlight");
            return;
        }
        HighlightMap highlight = session.highlight(color, kind);
        send(highlight.isEmpty() ? "Nothing to highlight" : highlight.toString());
    }

    private void help() {
        send("new                                    start a new quiz");
        send("show                                   print the board, the moves and the questions");
        send("submit <n...>                          answer every question, in the listed order");
        send("reveal                                 end the quiz and show the answers");
        send("highlight <white|black> <moves|checks|captures>");
        send("                                       list the target squares of these moves");
        send("clear                                  clear highlights");
        send("settings                               print the settings");
        send("set <key> <value>                      change a setting and start a new quiz");
        send("quit                                   leave");
    }

    private void send(String s) {
        out.println(s);
        out.flush();
    }
}
