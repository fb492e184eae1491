package max.chess.quiz.corpus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a {@link PositionCorpus} from a PGN file holding every game and a JSON weight index.
 * Locations are filesystem paths or {@code classpath:} resources.
 */
public final class CorpusLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(CorpusLoader.class);
    private static final String CLASSPATH_PREFIX = "classpath:";

    private final ObjectMapper objectMapper;

    public CorpusLoader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public CorpusLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PositionCorpus load(String gamesLocation, String weightsLocation) {
        LOGGER.info("Loading games from {}", gamesLocation);
        List<GameRecord> games;
        try(InputStream in = open(gamesLocation)) {
            games = splitTranscripts(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CorpusException("Cannot read games from " + gamesLocation, e);
        }
        LOGGER.info("Number of games found: {}", games.size());

        LOGGER.info("Loading weights from {}", weightsLocation);
        List<WeightEntry> weights;
        try(InputStream in = open(weightsLocation)) {
            weights = parseWeights(in, games.size());
        } catch (IOException e) {
            throw new CorpusException("Cannot read weights from " + weightsLocation, e);
        }
        LOGGER.info("Loaded {} weight rows", weights.size());

        return new PositionCorpus(games, weights);
    }

    /**
     * Splits a concatenation of PGN games. Sections are separated by blank lines; a section starting
     * with a tag pair starts a new game, any other section belongs to the game being read.
     *
     * @throws CorpusException if no game is found
     */
    public static List<GameRecord> splitTranscripts(String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        List<String> transcripts = new ArrayList<>();
        StringBuilder currentGame = null;
        for(String section : normalized.split("\n\\s*\n")) {
            if(section.isBlank()) {
                continue;
            }
            if(section.startsWith("[")) {
                if(currentGame != null) {
                    transcripts.add(currentGame.toString().trim());
                }
                currentGame = new StringBuilder(section);
            } else if(currentGame == null) {
                currentGame = new StringBuilder(section);
            } else {
                currentGame.append("\n\n").append(section);
            }
        }
        if(currentGame != null) {
            transcripts.add(currentGame.toString().trim());
        }

        if(transcripts.isEmpty()) {
            throw new CorpusException("No game found in PGN text");
        }
        List<GameRecord> games = new ArrayList<>(transcripts.size());
        for(int i = 0; i < transcripts.size(); i++) {
            games.add(new GameRecord(i, transcripts.get(i)));
        }
        return games;
    }

    /**
     * Reads a JSON array of {@code {game, ply, weight}} rows. Rows pointing outside the game list, with a
     * negative ply or a weight that is not a positive number are dropped.
     */
    public List<WeightEntry> parseWeights(InputStream in, int gameCount) throws IOException {
        List<WeightEntry> rows;
        try {
            rows = objectMapper.readValue(in, new TypeReference<List<WeightEntry>>() {});
        } catch (JsonProcessingException e) {
            throw new CorpusException("Malformed weight index: " + e.getOriginalMessage(), e);
        }
        if(rows == null) {
            throw new CorpusException("Weight index is empty");
        }

        List<WeightEntry> weights = new ArrayList<>(rows.size());
        for(WeightEntry row : rows) {
            if(row == null) {
                LOGGER.warn("Dropping null weight row");
            } else if(row.gameRef() < 0 || row.gameRef() >= gameCount) {
                LOGGER.warn("Dropping weight row {}: game out of range [0, {})", row, gameCount);
            } else if(row.ply() < 0) {
                LOGGER.warn("Dropping weight row {}: negative ply", row);
            } else if(!(row.weight() > 0) || Double.isInfinite(row.weight())) {
                LOGGER.warn("Dropping weight row {}: weight must be a positive number", row);
            } else {
                weights.add(row);
            }
        }
        return weights;
    }

    static InputStream open(String location) throws IOException {
        if(location == null || location.isBlank()) {
            throw new CorpusException("No corpus location configured");
        }
        if(location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
            InputStream in = classLoader == null ? null : classLoader.getResourceAsStream(resource);
            if(in == null) {
                in = CorpusLoader.class.getClassLoader().getResourceAsStream(resource);
            }
            if(in == null) {
                throw new CorpusException("Resource not found: " + resource);
            }
            return in;
        }
        try {
            return Files.newInputStream(Path.of(location));
        } catch (NoSuchFileException e) {
            throw new CorpusException("File not found: " + location, e);
        }
    }
}
