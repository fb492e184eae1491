package max.chess.quiz.session;

import max.chess.quiz.common.PieceType;
import max.chess.quiz.puzzle.MoveTarget;
import max.chess.quiz.utils.notations.MoveIOUtils;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Target squares of an answer, with how many counted moves of each piece kind land on each of them.
 * A piece kind reaching a square through several moves is a duplicate and gets marked as such.
 */
public final class HighlightMap {
    private final int color;
    private final Map<Integer, Map<PieceType, Integer>> countsBySquare = new TreeMap<>();

    public HighlightMap(List<MoveTarget> targets, int color) {
        this.color = color;
        for(MoveTarget target : targets) {
            countsBySquare.computeIfAbsent(target.square(), square -> new EnumMap<>(PieceType.class))
                    .merge(target.piece(), 1, Integer::sum);
        }
    }

    // Side whose moves are highlighted
    public int color() {
        return color;
    }

    public Set<Integer> squares() {
        return Collections.unmodifiableSet(countsBySquare.keySet());
    }

    public Set<PieceType> pieces(int square) {
        return Collections.unmodifiableSet(countsBySquare.getOrDefault(square, Map.of()).keySet());
    }

    public int count(int square, PieceType piece) {
        return countsBySquare.getOrDefault(square, Map.of()).getOrDefault(piece, 0);
    }

    public boolean isDuplicate(int square, PieceType piece) {
        return count(square, piece) >= 2;
    }

    // The only piece kind reaching the square, empty when several kinds do
    public Optional<PieceType> singlePiece(int square) {
        Set<PieceType> pieces = pieces(square);
        return pieces.size() == 1 ? Optional.of(pieces.iterator().next()) : Optional.empty();
    }

    public boolean isEmpty() {
        return countsBySquare.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for(Map.Entry<Integer, Map<PieceType, Integer>> entry : countsBySquare.entrySet()) {
            if(sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(MoveIOUtils.getSquareFromPosition(entry.getKey())).append(':');
            for(Map.Entry<PieceType, Integer> piece : entry.getValue().entrySet()) {
                sb.append(' ').append(Character.toUpperCase(piece.getKey().letter()));
                if(piece.getValue() >= 2) {
                    sb.append('x').append(piece.getValue());
                }
            }
        }
        return sb.toString();
    }
}
