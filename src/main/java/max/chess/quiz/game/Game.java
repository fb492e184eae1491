package max.chess.quiz.game;

import max.chess.quiz.game.board.Board;
import max.chess.quiz.movegen.Move;
import max.chess.quiz.movegen.MoveGenerator;
import max.chess.quiz.movegen.utils.CheckUtils;
import max.chess.quiz.utils.BitUtils;
import max.chess.quiz.utils.ColorUtils;
import max.chess.quiz.utils.PieceUtils;
import max.chess.quiz.utils.notations.FENUtils;

public class Game {

    private final Board board;

    public int currentPlayer = ColorUtils.WHITE;
    public boolean whiteCanCastleKingSide = true;
    public boolean whiteCanCastleQueenSide = true;
    public boolean blackCanCastleKingSide = true;
    public boolean blackCanCastleQueenSide = true;

    public int halfMoveClock = 0;
    public int fullMoveClock = 1;

    public Game() {
        board = new Board();
    }

    private Game(Game other) {
        this.board = new Board(other.board);
        this.currentPlayer = other.currentPlayer;
        this.whiteCanCastleKingSide = other.whiteCanCastleKingSide;
        this.whiteCanCastleQueenSide = other.whiteCanCastleQueenSide;
        this.blackCanCastleKingSide = other.blackCanCastleKingSide;
        this.blackCanCastleQueenSide = other.blackCanCastleQueenSide;
        this.halfMoveClock = other.halfMoveClock;
        this.fullMoveClock = other.fullMoveClock;
    }

    public Game copy() {
        return new Game(this);
    }

    /**
     * Returns a copy of this game where {@code color} is to move. Board, castling rights, en passant square
     * and clocks are left untouched, so the result is not necessarily a reachable position.
     */
    public Game withSideToMove(int color) {
        Game flipped = copy();
        flipped.currentPlayer = color;
        return flipped;
    }

    public int[] getLegalMoves() {
        return MoveGenerator.generateMoves(this);
    }

    public int getLegalMovesCount() {
        return MoveGenerator.generateMoves(this).length;
    }

    // Applies a move produced by the move generator for this position
    public void playMove(int move) {
        int color = currentPlayer;
        int opponent = ColorUtils.switchColor(color);
        int startPosition = Move.getStartPosition(move);
        int endPosition = Move.getEndPosition(move);
        byte pieceType = Move.getPieceType(move);
        byte promotion = Move.getPromotion(move);
        byte pieceEaten = Move.getPieceEaten(move);

        if(Move.isCastleKingSide(move)) {
            board.updateBBs(startPosition, endPosition, PieceUtils.KING, color);
            board.updateBBs(startPosition + 3, startPosition + 1, PieceUtils.ROOK, color);
        } else if(Move.isCastleQueenSide(move)) {
            board.updateBBs(startPosition, endPosition, PieceUtils.KING, color);
            board.updateBBs(startPosition - 4, startPosition - 1, PieceUtils.ROOK, color);
        } else {
            if(Move.isEnPassant(move)) {
                int enPassantEatenIndex = endPosition - ColorUtils.forward(color);
                board.removeFromBBs(BitUtils.getPositionIndexBitMask(enPassantEatenIndex), PieceUtils.PAWN, opponent);
            } else if(pieceEaten != PieceUtils.NONE) {
                board.removeFromBBs(BitUtils.getPositionIndexBitMask(endPosition), pieceEaten, opponent);
            }

            if(promotion != PieceUtils.NONE) {
                board.removeFromBBs(BitUtils.getPositionIndexBitMask(startPosition), pieceType, color);
                board.addToBBs(BitUtils.getPositionIndexBitMask(endPosition), promotion, color);
            } else {
                board.updateBBs(startPosition, endPosition, pieceType, color);
            }
        }

        if(pieceType == PieceUtils.PAWN && Math.abs(endPosition - startPosition) == 16) {
            board.enPassantIndex = (startPosition + endPosition) / 2;
        } else {
            board.enPassantIndex = -1;
        }

        if(pieceType == PieceUtils.KING) {
            if(ColorUtils.isWhite(color)) {
                whiteCanCastleKingSide = false;
                whiteCanCastleQueenSide = false;
            } else {
                blackCanCastleKingSide = false;
                blackCanCastleQueenSide = false;
            }
        }

        // Removing castling rights when a rook leaves or is captured on its corner
        if(endPosition == 7 || startPosition == 7) {
            whiteCanCastleKingSide = false;
        }
        if(endPosition == 0 || startPosition == 0) {
            whiteCanCastleQueenSide = false;
        }
        if(endPosition == 63 || startPosition == 63) {
            blackCanCastleKingSide = false;
        }
        if(endPosition == 56 || startPosition == 56) {
            blackCanCastleQueenSide = false;
        }

        if(pieceType == PieceUtils.PAWN || pieceEaten != PieceUtils.NONE) {
            halfMoveClock = 0;
        } else {
            halfMoveClock++;
        }

        if(ColorUtils.isBlack(color)) {
            fullMoveClock++;
        }

        currentPlayer = opponent;
    }

    // Is the side to move in check
    public boolean inCheck() {
        return isKingAttacked(currentPlayer);
    }

    public boolean isKingAttacked(int kingColor) {
        long kingBB = board.getKingBB(kingColor);
        if(kingBB == 0L) {
            return false;
        }
        return CheckUtils.isSquareAttacked(BitUtils.bitScanForward(kingBB), board, ColorUtils.switchColor(kingColor));
    }

    public Board board() {
        return board;
    }

    public boolean isWhiteToMove() {
        return ColorUtils.isWhite(currentPlayer);
    }

    public String toFEN() {
        return FENUtils.getFENFromBoard(this);
    }

    @Override
    public String toString() {
        return boardAscii(this);
    }

    /** Returns an ASCII diagram of the board (ranks 8..1). */
    public static String boardAscii(Game game) {
        return boardAscii(game, false);
    }

    /** Returns an ASCII diagram of the board, seen from black's side when {@code flipped} is set. */
    public static String boardAscii(Game game, boolean flipped) {
        Board b = game.board();
        StringBuilder sb = new StringBuilder(8 * (8 + 4));
        for (int row = 0; row < 8; row++) {
            int rank = flipped ? row : 7 - row;
            sb.append(rank + 1).append("  ");
            for (int column = 0; column < 8; column++) {
                int file = flipped ? 7 - column : column;
                sb.append(pieceCharAt(b, rank * 8 + file)).append(' ');
            }
            sb.append('\n');
        }
        sb.append(flipped ? "\n   h g f e d c b a" : "\n   a b c d e f g h");
        return sb.toString();
    }

    /** Returns FEN char for the piece on sq, or '.' if empty. Uppercase = white, lowercase = black. */
    private static char pieceCharAt(Board b, int sq) {
        int pt = b.getPieceTypeAt(sq);
        if (pt == PieceUtils.NONE) return '.';
        char c = PieceUtils.toPieceType(pt).letter();
        return ColorUtils.isWhite(b.getColorAt(sq)) ? Character.toUpperCase(c) : c;
    }
}
