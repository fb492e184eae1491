package max.chess.quiz.puzzle;

import max.chess.quiz.corpus.WeightEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/** Weighted draw of a (game, ply) sampling point with a given side to move. */
public class PositionSampler {
    private static final Logger LOGGER = LoggerFactory.getLogger(PositionSampler.class);

    private final RandomGenerator random;

    public PositionSampler(RandomGenerator random) {
        this.random = random;
    }

    /**
     * @param weightIndex        sampling points, scanned in this order
     * @param requireWhiteToMove pick among even plies when set, odd plies otherwise
     * @throws EmptyPartitionException if no entry has the requested parity or their weights do not sum up
     */
    public SampledPly sample(List<WeightEntry> weightIndex, boolean requireWhiteToMove) {
        List<WeightEntry> filtered = new ArrayList<>();
        double totalWeight = 0;
        for(WeightEntry entry : weightIndex) {
            if(entry.isWhiteToMove() == requireWhiteToMove) {
                filtered.add(entry);
                totalWeight += entry.weight();
            }
        }
        if(filtered.isEmpty() || !(totalWeight > 0)) {
            throw new EmptyPartitionException("No entries available for "
                    + (requireWhiteToMove ? "white" : "black") + " to move");
        }

        double threshold = random.nextDouble() * totalWeight;
        for(WeightEntry entry : filtered) {
            threshold -= entry.weight();
            if(threshold < 0) {
                return selected(entry);
            }
        }
        // Rounding can leave a tiny positive remainder after the last entry
        return selected(filtered.get(filtered.size() - 1));
    }

    private static SampledPly selected(WeightEntry entry) {
        LOGGER.debug("Selected: game={}, ply={}, weight={}", entry.gameRef(), entry.ply(), entry.weight());
        return new SampledPly(entry.gameRef(), entry.ply());
    }
}
