package max.chess.quiz.session;

import max.chess.quiz.puzzle.InvalidQuestionTypeException;
import max.chess.quiz.puzzle.QuestionType;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.StringJoiner;

public final class QuizConfig {
    public static final String DEFAULT_RESOURCE = "countquiz.properties";

    public static final String GAMES_KEY = "quiz.games";
    public static final String WEIGHTS_KEY = "quiz.weights";
    public static final String QUESTION_TYPES_KEY = "quiz.questionTypes";
    public static final String PLY_AHEAD_KEY = "quiz.plyAhead";
    public static final String SIDE_TO_MOVE_KEY = "quiz.sideToMove";
    public static final String TIME_SECONDS_KEY = "quiz.timeSeconds";
    public static final String SHOW_TIMER_KEY = "quiz.showTimer";
    public static final String PENALTY_SECONDS_KEY = "quiz.penaltySeconds";

    public static final List<String> KEYS = List.of(GAMES_KEY, WEIGHTS_KEY, QUESTION_TYPES_KEY, PLY_AHEAD_KEY,
            SIDE_TO_MOVE_KEY, TIME_SECONDS_KEY, SHOW_TIMER_KEY, PENALTY_SECONDS_KEY);

    // Corpus, "classpath:" resources or filesystem paths
    public final String gamesLocation;
    public final String weightsLocation;

    public final List<QuestionType> questionTypes;
    public final int plyAhead;              // half-moves shown before the scored position
    public final SideToMoveMode sideToMove; // side to move on the preview board

    // Timer
    public final int timeSeconds;
    public final boolean showTimer;         // hidden timer means unbounded time
    public final int penaltySeconds;

    private QuizConfig(Builder b) {
        gamesLocation = b.gamesLocation;
        weightsLocation = b.weightsLocation;
        questionTypes = List.copyOf(b.questionTypes);
        plyAhead = b.plyAhead;
        sideToMove = b.sideToMove;
        timeSeconds = b.timeSeconds;
        showTimer = b.showTimer;
        penaltySeconds = b.penaltySeconds;
    }

    public static QuizConfig defaults() {
        return new Builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
                .gamesLocation(gamesLocation).weightsLocation(weightsLocation)
                .questionTypes(questionTypes).plyAhead(plyAhead).sideToMove(sideToMove)
                .timeSeconds(timeSeconds).showTimer(showTimer).penaltySeconds(penaltySeconds);
    }

    public Properties toProperties() {
        Properties properties = new Properties();
        properties.setProperty(GAMES_KEY, gamesLocation);
        properties.setProperty(WEIGHTS_KEY, weightsLocation);
        StringJoiner types = new StringJoiner(",");
        questionTypes.forEach(questionType -> types.add(questionType.toString()));
        properties.setProperty(QUESTION_TYPES_KEY, types.toString());
        properties.setProperty(PLY_AHEAD_KEY, Integer.toString(plyAhead));
        properties.setProperty(SIDE_TO_MOVE_KEY, sideToMove.name());
        properties.setProperty(TIME_SECONDS_KEY, Integer.toString(timeSeconds));
        properties.setProperty(SHOW_TIMER_KEY, Boolean.toString(showTimer));
        properties.setProperty(PENALTY_SECONDS_KEY, Integer.toString(penaltySeconds));
        return properties;
    }

    /**
     * A copy with one setting changed, checked like a value read from a file.
     *
     * @throws IllegalArgumentException if the key is unknown or the value invalid
     */
    public QuizConfig with(String key, String value) {
        if(!KEYS.contains(key)) {
            throw new IllegalArgumentException("Unknown setting '" + key + "', expected one of " + KEYS);
        }
        Properties properties = toProperties();
        properties.setProperty(key, value);
        return fromProperties(properties);
    }

    /** Bundled defaults, overridden by the properties file at {@code path} when it is given. */
    public static QuizConfig load(String path) throws IOException {
        Properties properties = bundledProperties();
        if(path != null) {
            try(Reader reader = Files.newBufferedReader(Path.of(path), StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
        }
        return fromProperties(properties);
    }

    static Properties bundledProperties() throws IOException {
        Properties properties = new Properties();
        try(InputStream in = QuizConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if(in != null) {
                properties.load(in);
            }
        }
        return properties;
    }

    /** Missing keys keep their default value. */
    public static QuizConfig fromProperties(Properties properties) {
        Builder builder = new Builder();
        String value;
        if((value = properties.getProperty(GAMES_KEY)) != null) {
            builder.gamesLocation(value.trim());
        }
        if((value = properties.getProperty(WEIGHTS_KEY)) != null) {
            builder.weightsLocation(value.trim());
        }
        if((value = properties.getProperty(QUESTION_TYPES_KEY)) != null) {
            builder.questionTypes(parseQuestionTypes(value));
        }
        if((value = properties.getProperty(PLY_AHEAD_KEY)) != null) {
            builder.plyAhead(parseInt(PLY_AHEAD_KEY, value));
        }
        if((value = properties.getProperty(SIDE_TO_MOVE_KEY)) != null) {
            try {
                builder.sideToMove(SideToMoveMode.valueOf(value.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(SIDE_TO_MOVE_KEY + " must be WHITE, BLACK or RANDOM, got '" + value + "'", e);
            }
        }
        if((value = properties.getProperty(TIME_SECONDS_KEY)) != null) {
            builder.timeSeconds(parseInt(TIME_SECONDS_KEY, value));
        }
        if((value = properties.getProperty(SHOW_TIMER_KEY)) != null) {
            builder.showTimer(parseBoolean(SHOW_TIMER_KEY, value));
        }
        if((value = properties.getProperty(PENALTY_SECONDS_KEY)) != null) {
            builder.penaltySeconds(parseInt(PENALTY_SECONDS_KEY, value));
        }
        return builder.build();
    }

    private static List<QuestionType> parseQuestionTypes(String value) {
        List<QuestionType> questionTypes = new ArrayList<>();
        for(String token : value.split(",")) {
            if(token.isBlank()) {
                continue;
            }
            try {
                questionTypes.add(QuestionType.parse(token));
            } catch (InvalidQuestionTypeException e) {
                throw new IllegalArgumentException(QUESTION_TYPES_KEY + ": " + e.getMessage(), e);
            }
        }
        return questionTypes;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if(!normalized.equals("true") && !normalized.equals("false")) {
            throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
        }
        return Boolean.parseBoolean(normalized);
    }

    public static class Builder {
        private String gamesLocation = "classpath:corpus/games.pgn";
        private String weightsLocation = "classpath:corpus/weights.json";

        private List<QuestionType> questionTypes = List.of(
                QuestionType.MOVER_CHECKS, QuestionType.MOVER_CAPTURES,
                QuestionType.OPPONENT_CHECKS, QuestionType.OPPONENT_CAPTURES);
        private int plyAhead = 0;
        private SideToMoveMode sideToMove = SideToMoveMode.RANDOM;

        private int timeSeconds = 180;
        private boolean showTimer = true;
        private int penaltySeconds = 10;

        public Builder gamesLocation(String v){gamesLocation=v;return this;}
        public Builder weightsLocation(String v){weightsLocation=v;return this;}
        public Builder questionTypes(List<QuestionType> v){questionTypes=List.copyOf(new LinkedHashSet<>(v));return this;}
        public Builder plyAhead(int v){plyAhead=v;return this;}
        public Builder sideToMove(SideToMoveMode v){sideToMove=v;return this;}
        public Builder timeSeconds(int v){timeSeconds=v;return this;}
        public Builder showTimer(boolean v){showTimer=v;return this;}
        public Builder penaltySeconds(int v){penaltySeconds=v;return this;}

        public QuizConfig build() {
            if(questionTypes.isEmpty()) {
                throw new IllegalArgumentException(QUESTION_TYPES_KEY + " must name at least one question type");
            }
            if(plyAhead < 0) {
                throw new IllegalArgumentException(PLY_AHEAD_KEY + " must not be negative, got " + plyAhead);
            }
            if(timeSeconds <= 0) {
                throw new IllegalArgumentException(TIME_SECONDS_KEY + " must be positive, got " + timeSeconds);
            }
            if(penaltySeconds < 0) {
                throw new IllegalArgumentException(PENALTY_SECONDS_KEY + " must not be negative, got " + penaltySeconds);
            }
            if(sideToMove == null) {
                throw new IllegalArgumentException(SIDE_TO_MOVE_KEY + " is required");
            }
            return new QuizConfig(this);
        }
    }
}
