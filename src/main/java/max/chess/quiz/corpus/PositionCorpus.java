package max.chess.quiz.corpus;

import java.util.List;

/** The games and the weight index of a quiz. Read-only once loaded. */
public final class PositionCorpus {
    private final List<GameRecord> games;
    private final List<WeightEntry> weights;

    public PositionCorpus(List<GameRecord> games, List<WeightEntry> weights) {
        if(games.isEmpty()) {
            throw new CorpusException("A corpus needs at least one game");
        }
        this.games = List.copyOf(games);
        this.weights = List.copyOf(weights);
    }

    public GameRecord game(int gameRef) {
        if(gameRef < 0 || gameRef >= games.size()) {
            throw new CorpusException("No game " + gameRef + " in a corpus of " + games.size() + " games");
        }
        return games.get(gameRef);
    }

    public List<GameRecord> games() {
        return games;
    }

    public List<WeightEntry> weights() {
        return weights;
    }

    public int gameCount() {
        return games.size();
    }
}
