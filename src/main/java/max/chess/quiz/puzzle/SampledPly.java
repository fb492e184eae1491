package max.chess.quiz.puzzle;

public record SampledPly(int gameRef, int ply) {
}
