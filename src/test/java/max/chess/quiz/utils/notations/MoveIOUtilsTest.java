package max.chess.quiz.utils.notations;

import max.chess.quiz.game.Game;
import max.chess.quiz.game.board.utils.BoardGenerator;
import max.chess.quiz.movegen.Move;
import max.chess.quiz.utils.PieceUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MoveIOUtilsTest {
    // Ruy Lopez, Breyer variation after 10. d4
    private static final String BREYER = "rnbq1rk1/2p1bppp/p2p1n2/1p2p3/3PP3/1BP2N1P/PP3PP1/RNBQR1K1 b - - 0 10";
    private static final String CASTLING = "r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1";

    @Test
    public void squareConversions() {
        assertEquals("a1", MoveIOUtils.getSquareFromPosition(0));
        assertEquals("h1", MoveIOUtils.getSquareFromPosition(7));
        assertEquals("e4", MoveIOUtils.getSquareFromPosition(28));
        assertEquals("h8", MoveIOUtils.getSquareFromPosition(63));
        assertEquals(0, MoveIOUtils.getPositionFromSquare("a1"));
        assertEquals(28, MoveIOUtils.getPositionFromSquare("e4"));
        assertEquals(56, MoveIOUtils.getPositionFromSquare("a8"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "e", "i1", "a9", "A1", "e44"})
    public void invalidSquaresShouldBeRejected(String square) {
        assertThrows(IllegalArgumentException.class, () -> MoveIOUtils.getPositionFromSquare(square));
    }

    @Test
    public void uciNotation() {
        assertEquals("e2e4", MoveIOUtils.toUCINotation(Move.asBytes(12, 28, PieceUtils.PAWN)));
        assertEquals("a7a8q", MoveIOUtils.toUCINotation(Move.asBytes(48, 56, PieceUtils.PAWN, PieceUtils.QUEEN, PieceUtils.NONE)));
    }

    @Test
    public void standardGameSan() {
        // When
        List<String> sans = sans(BoardGenerator.newStandardGameBoard());

        // Then
        assertEquals(20, sans.size());
        assertTrue(sans.containsAll(List.of("a3", "e4", "h4", "Na3", "Nc3", "Nf3", "Nh3")));
    }

    @Test
    public void sanIsDisambiguatedByFile() {
        // Given
        // knights on b8 and f6 can both reach d7
        Game game = BoardGenerator.from(BREYER);

        // When
        List<String> sans = sans(game);

        // Then
        assertTrue(sans.contains("Nbd7"));
        assertTrue(sans.contains("Nfd7"));
        assertFalse(sans.contains("Nd7"));
    }

    @Test
    public void sanIsDisambiguatedByRank() {
        // When
        List<String> sans = sans(BoardGenerator.from("4k3/8/8/R7/8/8/8/R3K3 w - - 0 1"));

        // Then
        assertTrue(sans.contains("R1a3"));
        assertTrue(sans.contains("R5a3"));
        assertTrue(sans.contains("Rb1"));
    }

    @Test
    public void sanIsDisambiguatedBySquare() {
        // When
        List<String> sans = sans(BoardGenerator.from("4k3/8/8/8/8/Q7/8/Q1Q1K3 w - - 0 1"));

        // Then
        assertTrue(sans.contains("Qa1b2"));
        assertTrue(sans.contains("Q3b2"));
        assertTrue(sans.contains("Qcb2"));
    }

    @Test
    public void promotionsAndMates() {
        // When
        List<String> sans = sans(BoardGenerator.from("8/P7/8/8/8/8/8/k1K5 w - - 0 1"));

        // Then
        assertTrue(sans.containsAll(List.of("a8=Q#", "a8=R#", "a8=B", "a8=N")));
    }

    @Test
    public void castlesAndChecks() {
        assertTrue(sans(BoardGenerator.from(CASTLING)).containsAll(List.of("O-O", "O-O-O", "Rxa8+", "Rxh8+")));
        assertTrue(sans(BoardGenerator.from("rnbqkbnr/pppp1ppp/8/4p3/6P1/5P2/PPPPP2P/RNBQKBNR b KQkq g3 0 2")).contains("Qh4#"));
    }

    @Test
    public void enPassantSan() {
        List<String> sans = sans(BoardGenerator.from("rnbqkb1r/ppp1pppp/5n2/3pP3/8/8/PPPP1PPP/RNBQKBNR w KQkq d6 0 3"));
        assertTrue(sans.contains("exd6"));
        assertTrue(sans.contains("exf6"));
    }

    @Test
    public void resolveSan() {
        Game standard = BoardGenerator.newStandardGameBoard();
        assertEquals(28, Move.getEndPosition(MoveIOUtils.resolveSan(standard, "e4")));
        assertEquals(21, Move.getEndPosition(MoveIOUtils.resolveSan(standard, "Ngf3")));
        assertEquals(21, Move.getEndPosition(MoveIOUtils.resolveSan(standard, "Ng1f3!?")));

        Game castling = BoardGenerator.from(CASTLING);
        assertTrue(Move.isCastleKingSide(MoveIOUtils.resolveSan(castling, "0-0")));
        assertTrue(Move.isCastleQueenSide(MoveIOUtils.resolveSan(castling, "O-O-O+")));

        int promotion = MoveIOUtils.resolveSan(BoardGenerator.from("8/P7/8/8/8/8/8/k1K5 w - - 0 1"), "a8N");
        assertEquals(PieceUtils.KNIGHT, Move.getPromotion(promotion));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Ke2", "e5", "xyz", "Nd2", "O-O", "e4=Q", ""})
    public void unplayableSanShouldBeRejected(String token) {
        Game standard = BoardGenerator.newStandardGameBoard();
        assertThrows(IllegalArgumentException.class, () -> MoveIOUtils.resolveSan(standard, token));
    }

    @Test
    public void ambiguousSanShouldBeRejected() {
        Game game = BoardGenerator.from("4k3/8/8/R7/8/8/8/R3K3 w - - 0 1");
        assertThrows(IllegalArgumentException.class, () -> MoveIOUtils.resolveSan(game, "Ra3"));
    }

    static List<String> sans(Game game) {
        int[] legalMoves = game.getLegalMoves();
        return Arrays.stream(legalMoves)
                .mapToObj(move -> MoveIOUtils.writeSan(game, move, legalMoves))
                .collect(Collectors.toList());
    }
}
