package max.chess.quiz.movegen;

import max.chess.quiz.game.Game;
import max.chess.quiz.game.board.utils.BoardGenerator;
import max.chess.quiz.utils.ColorUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

// https://www.chessprogramming.org/Perft_Results
public class MoveGeneratorPerftTest {
    private static final String FEN_POSITION_2 = "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1";
    private static final String FEN_POSITION_3 = "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 w - - 0 1";
    private static final String FEN_POSITION_4 = "r3k2r/Pppp1ppp/1b3nbN/nP6/BBP1P3/q4N2/Pp1P2PP/R2Q1RK1 w kq - 0 1";

    public static Stream<Arguments> getPerftTestSet() {
        return Stream.of(
                Arguments.of("Standard board", BoardGenerator.STANDARD_GAME, 1, 20L),
                Arguments.of("Standard board", BoardGenerator.STANDARD_GAME, 2, 400L),
                Arguments.of("Standard board", BoardGenerator.STANDARD_GAME, 3, 8_902L),
                Arguments.of("Position 2", FEN_POSITION_2, 1, 48L),
                Arguments.of("Position 2", FEN_POSITION_2, 2, 2_039L),
                Arguments.of("Position 2", FEN_POSITION_2, 3, 97_862L),
                Arguments.of("Position 3", FEN_POSITION_3, 1, 14L),
                Arguments.of("Position 3", FEN_POSITION_3, 2, 191L),
                Arguments.of("Position 3", FEN_POSITION_3, 3, 2_812L),
                Arguments.of("Position 4", FEN_POSITION_4, 1, 6L),
                Arguments.of("Position 4", FEN_POSITION_4, 2, 264L),
                Arguments.of("Position 4", FEN_POSITION_4, 3, 9_467L)
        );
    }

    @ParameterizedTest(name = "{0} at depth {2}")
    @MethodSource("getPerftTestSet")
    public void runPerftTest(String testName, String fen, int depth, long expectedNodes) {
        // Given
        Game game = BoardGenerator.from(fen);

        // When
        long nodes = perft(game, depth);

        // Then
        assertEquals(expectedNodes, nodes, testName + " at depth " + depth);
    }

    @Test
    public void enPassantIsOnlyOfferedToTheSideThatCanTakeIt() {
        // Given
        Game game = BoardGenerator.from("rnbqkb1r/ppp1pppp/5n2/3pP3/8/8/PPPP1PPP/RNBQKBNR w KQkq d6 0 3");

        // When
        int[] whiteMoves = game.getLegalMoves();
        int[] blackMoves = game.withSideToMove(ColorUtils.BLACK).getLegalMoves();

        // Then
        assertTrue(Arrays.stream(whiteMoves).anyMatch(Move::isEnPassant));
        assertFalse(Arrays.stream(blackMoves).anyMatch(Move::isEnPassant));
    }

    @Test
    public void checkmatedSideHasNoLegalMove() {
        // Given
        Game game = BoardGenerator.from("rnb1kbnr/pppp1ppp/8/4p3/6Pq/5P2/PPPPP2P/RNBQKBNR w KQkq - 1 3");

        // Then
        assertTrue(game.inCheck());
        assertEquals(0, game.getLegalMovesCount());
    }

    private static long perft(Game game, int depth) {
        int[] moves = game.getLegalMoves();
        if(depth == 1) {
            return moves.length;
        }
        long nodes = 0;
        for(int move : moves) {
            Game next = game.copy();
            next.playMove(move);
            nodes += perft(next, depth - 1);
        }
        return nodes;
    }
}
