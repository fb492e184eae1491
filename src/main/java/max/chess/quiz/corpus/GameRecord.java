package max.chess.quiz.corpus;

/**
 * One game of the corpus, kept as its raw transcript.
 *
 * @param index      position of the game in the corpus, referenced by weight entries
 * @param transcript PGN text of the game, tag pairs included
 */
public record GameRecord(int index, String transcript) {
}
