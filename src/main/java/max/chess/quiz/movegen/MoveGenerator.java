package max.chess.quiz.movegen;

import max.chess.quiz.game.Game;
import max.chess.quiz.game.board.Board;
import max.chess.quiz.movegen.pieces.Bishop;
import max.chess.quiz.movegen.pieces.King;
import max.chess.quiz.movegen.pieces.Knight;
import max.chess.quiz.movegen.pieces.Pawn;
import max.chess.quiz.movegen.pieces.Rook;
import max.chess.quiz.movegen.utils.CheckUtils;
import max.chess.quiz.utils.BitUtils;
import max.chess.quiz.utils.ColorUtils;
import max.chess.quiz.utils.PieceUtils;

import java.util.Arrays;

/**
 * Legal move generation. Moves are generated pseudo-legally piece type by piece type, then each one is
 * played on a copy of the game and kept only if it does not leave the mover's king attacked.
 */
public final class MoveGenerator {
    // According to literature, maximum number of legal moves in a given position is 218
    private static final int MAX_MOVES = 256;

    private static final long WHITE_KING_SIDE_PASSAGE_BB = (0b11L << 5);
    private static final long WHITE_QUEEN_SIDE_PASSAGE_BB = (0b111L << 1);
    private static final long BLACK_KING_SIDE_PASSAGE_BB = (0b11L << 61);
    private static final long BLACK_QUEEN_SIDE_PASSAGE_BB = (0b111L << 57);

    private MoveGenerator() {
    }

    public static int[] generateMoves(Game game) {
        int[] buffer = new int[MAX_MOVES];
        int pseudoLegalCount = generatePseudoLegalMoves(game, buffer);

        int legalCount = 0;
        for(int i = 0; i < pseudoLegalCount; i++) {
            int move = buffer[i];
            if(isLegal(game, move)) {
                buffer[legalCount++] = move;
            }
        }
        return Arrays.copyOf(buffer, legalCount);
    }

    public static boolean isLegal(Game game, int move) {
        int side = game.currentPlayer;
        Game trial = game.copy();
        trial.playMove(move);
        return !trial.isKingAttacked(side);
    }

    static int generatePseudoLegalMoves(Game game, int[] buffer) {
        final Board board = game.board();
        final int side = game.currentPlayer;
        final long friendlyBB = board.getColorBB(side);
        final long enemyBB = board.getColorBB(ColorUtils.switchColor(side));
        // Kings are never captured, a position where it would be possible is not a legal one anyway
        final long capturableBB = enemyBB & ~board.kingBB;
        final long blockedBB = friendlyBB | (enemyBB & board.kingBB);
        final long occupiedBB = board.gameBB;

        int count = 0;

        long pawnsBB = board.pawnBB & friendlyBB;
        while(pawnsBB != 0) {
            int from = BitUtils.bitScanForward(pawnsBB);
            pawnsBB &= pawnsBB - 1;
            long targetsBB = Pawn.getPushesBB(from, side, occupiedBB)
                    | (Pawn.getAttackBB(from, side) & capturableBB);
            count = addPawnMoves(board, from, targetsBB, side, buffer, count);
        }
        count = addEnPassantMoves(board, side, buffer, count);

        long knightsBB = board.knightBB & friendlyBB;
        while(knightsBB != 0) {
            int from = BitUtils.bitScanForward(knightsBB);
            knightsBB &= knightsBB - 1;
            count = addMovesFromBitboard(board, PieceUtils.KNIGHT, from, Knight.getMovesBB(from, blockedBB), buffer, count);
        }

        long bishopsBB = board.bishopBB & friendlyBB;
        while(bishopsBB != 0) {
            int from = BitUtils.bitScanForward(bishopsBB);
            bishopsBB &= bishopsBB - 1;
            count = addMovesFromBitboard(board, PieceUtils.BISHOP, from, Bishop.getMovesBB(from, blockedBB, occupiedBB), buffer, count);
        }

        long rooksBB = board.rookBB & friendlyBB;
        while(rooksBB != 0) {
            int from = BitUtils.bitScanForward(rooksBB);
            rooksBB &= rooksBB - 1;
            count = addMovesFromBitboard(board, PieceUtils.ROOK, from, Rook.getMovesBB(from, blockedBB, occupiedBB), buffer, count);
        }

        long queensBB = board.queenBB & friendlyBB;
        while(queensBB != 0) {
            int from = BitUtils.bitScanForward(queensBB);
            queensBB &= queensBB - 1;
            long movesBB = Rook.getMovesBB(from, blockedBB, occupiedBB) | Bishop.getMovesBB(from, blockedBB, occupiedBB);
            count = addMovesFromBitboard(board, PieceUtils.QUEEN, from, movesBB, buffer, count);
        }

        long kingBB = board.kingBB & friendlyBB;
        if(kingBB != 0) {
            int from = BitUtils.bitScanForward(kingBB);
            count = addMovesFromBitboard(board, PieceUtils.KING, from, King.getMovesBB(from, blockedBB), buffer, count);
            count = addCastleMoves(game, side, buffer, count);
        }

        return count;
    }

    private static int addMovesFromBitboard(Board board, byte pieceType, int from, long movesBB, int[] buffer, int count) {
        while(movesBB != 0) {
            int to = BitUtils.bitScanForward(movesBB);
            movesBB &= movesBB - 1;
            buffer[count++] = Move.asBytes(from, to, pieceType, PieceUtils.NONE, board.getPieceTypeAt(to));
        }
        return count;
    }

    private static int addPawnMoves(Board board, int from, long targetsBB, int side, int[] buffer, int count) {
        while(targetsBB != 0) {
            int to = BitUtils.bitScanForward(targetsBB);
            targetsBB &= targetsBB - 1;
            byte pieceEaten = board.getPieceTypeAt(to);
            if(Pawn.isPromotionRank(to, side)) {
                for(byte promotion : PieceUtils.PROMOTIONS) {
                    buffer[count++] = Move.asBytes(from, to, PieceUtils.PAWN, promotion, pieceEaten);
                }
            } else {
                buffer[count++] = Move.asBytes(from, to, PieceUtils.PAWN, PieceUtils.NONE, pieceEaten);
            }
        }
        return count;
    }

    private static int addEnPassantMoves(Board board, int side, int[] buffer, int count) {
        int enPassantIndex = board.enPassantIndex;
        if(enPassantIndex == -1) {
            return count;
        }
        // The target square must lie behind an enemy pawn that just double pushed
        int expectedRank = ColorUtils.isWhite(side) ? 5 : 2;
        if(BitUtils.rank(enPassantIndex) != expectedRank || BitUtils.isSet(board.gameBB, enPassantIndex)) {
            return count;
        }
        int eatenIndex = enPassantIndex - ColorUtils.forward(side);
        long enemyPawnsBB = board.pawnBB & board.getColorBB(ColorUtils.switchColor(side));
        if(!BitUtils.isSet(enemyPawnsBB, eatenIndex)) {
            return count;
        }

        // Our pawns attacking the target square are the ones an enemy pawn there would attack
        long candidatesBB = Pawn.getAttackBB(enPassantIndex, ColorUtils.switchColor(side)) & board.pawnBB & board.getColorBB(side);
        while(candidatesBB != 0) {
            int from = BitUtils.bitScanForward(candidatesBB);
            candidatesBB &= candidatesBB - 1;
            buffer[count++] = Move.asBytesEnPassant(from, enPassantIndex);
        }
        return count;
    }

    private static int addCastleMoves(Game game, int side, int[] buffer, int count) {
        Board board = game.board();
        boolean white = ColorUtils.isWhite(side);
        int kingHome = white ? 4 : 60;
        if(board.getPieceTypeAt(kingHome) != PieceUtils.KING || board.getColorAt(kingHome) != side) {
            return count;
        }
        boolean canCastleKingSide = white ? game.whiteCanCastleKingSide : game.blackCanCastleKingSide;
        boolean canCastleQueenSide = white ? game.whiteCanCastleQueenSide : game.blackCanCastleQueenSide;
        if(!canCastleKingSide && !canCastleQueenSide) {
            return count;
        }
        int opponent = ColorUtils.switchColor(side);
        if(CheckUtils.isSquareAttacked(kingHome, board, opponent)) {
            return count;
        }

        if(canCastleKingSide
                && hasRook(board, kingHome + 3, side)
                && (board.gameBB & (white ? WHITE_KING_SIDE_PASSAGE_BB : BLACK_KING_SIDE_PASSAGE_BB)) == 0
                && !CheckUtils.isSquareAttacked(kingHome + 1, board, opponent)
                && !CheckUtils.isSquareAttacked(kingHome + 2, board, opponent)) {
            buffer[count++] = white ? Move.CASTLE_KING_SIDE_WHITE_MOVE : Move.CASTLE_KING_SIDE_BLACK_MOVE;
        }

        if(canCastleQueenSide
                && hasRook(board, kingHome - 4, side)
                && (board.gameBB & (white ? WHITE_QUEEN_SIDE_PASSAGE_BB : BLACK_QUEEN_SIDE_PASSAGE_BB)) == 0
                && !CheckUtils.isSquareAttacked(kingHome - 1, board, opponent)
                && !CheckUtils.isSquareAttacked(kingHome - 2, board, opponent)) {
            buffer[count++] = white ? Move.CASTLE_QUEEN_SIDE_WHITE_MOVE : Move.CASTLE_QUEEN_SIDE_BLACK_MOVE;
        }
        return count;
    }

    private static boolean hasRook(Board board, int positionIndex, int color) {
        return board.getPieceTypeAt(positionIndex) == PieceUtils.ROOK && board.getColorAt(positionIndex) == color;
    }
}
