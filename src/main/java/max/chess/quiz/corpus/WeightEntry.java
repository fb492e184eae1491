package max.chess.quiz.corpus;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A sampling point of the weight index.
 *
 * @param gameRef index of the game in the corpus
 * @param ply     half-moves played from the start position, even means white to move
 * @param weight  relative likelihood of being drawn
 */
public record WeightEntry(@JsonProperty("game") int gameRef,
                          @JsonProperty("ply") int ply,
                          @JsonProperty("weight") double weight) {

    public boolean isWhiteToMove() {
        return ply % 2 == 0;
    }
}
