package max.chess.quiz.game.board;

import max.chess.quiz.utils.BitUtils;
import max.chess.quiz.utils.ColorUtils;
import max.chess.quiz.utils.PieceUtils;

import java.util.Arrays;

public class Board {
    public long bishopBB = 0;
    public long queenBB = 0;
    public long kingBB = 0;
    public long knightBB = 0;
    public long rookBB = 0;
    public long pawnBB = 0;

    public long whiteBB = 0;
    public long blackBB = 0;

    public long gameBB = 0;

    // Square a pawn skipped over on the last double push, -1 if none
    public int enPassantIndex = -1;

    private final byte[] pieceAt;

    public Board() {
        this.pieceAt = new byte[64];
        Arrays.fill(pieceAt, PieceUtils.NONE);
    }

    public Board(Board other) {
        this.bishopBB = other.bishopBB;
        this.queenBB = other.queenBB;
        this.kingBB = other.kingBB;
        this.knightBB = other.knightBB;
        this.rookBB = other.rookBB;
        this.pawnBB = other.pawnBB;
        this.whiteBB = other.whiteBB;
        this.blackBB = other.blackBB;
        this.gameBB = other.gameBB;
        this.enPassantIndex = other.enPassantIndex;
        this.pieceAt = other.pieceAt.clone();
    }

    public byte getPieceTypeAt(int positionIndex) {
        return pieceAt[positionIndex];
    }

    // ColorUtils code of the piece on the square, 0 if empty
    public int getColorAt(int positionIndex) {
        long positionBB = BitUtils.getPositionIndexBitMask(positionIndex);
        if((whiteBB & positionBB) != 0) {
            return ColorUtils.WHITE;
        } else if((blackBB & positionBB) != 0) {
            return ColorUtils.BLACK;
        }
        return 0;
    }

    public long getColorBB(int color) {
        return ColorUtils.isWhite(color) ? whiteBB : blackBB;
    }

    public long getKingBB(int color) {
        return kingBB & getColorBB(color);
    }

    public void addToBBs(long bb, byte pieceType, int color) {
        switch (pieceType) {
            case PieceUtils.PAWN -> pawnBB |= bb;
            case PieceUtils.KNIGHT -> knightBB |= bb;
            case PieceUtils.BISHOP -> bishopBB |= bb;
            case PieceUtils.ROOK -> rookBB |= bb;
            case PieceUtils.QUEEN -> queenBB |= bb;
            case PieceUtils.KING -> kingBB |= bb;
            default -> {
                return;
            }
        }
        if(ColorUtils.isWhite(color)) {
            whiteBB |= bb;
        } else {
            blackBB |= bb;
        }
        gameBB |= bb;

        pieceAt[BitUtils.bitScanForward(bb)] = pieceType;
    }

    public void removeFromBBs(long bb, byte pieceType, int color) {
        switch (pieceType) {
            case PieceUtils.PAWN -> pawnBB &= ~bb;
            case PieceUtils.KNIGHT -> knightBB &= ~bb;
            case PieceUtils.BISHOP -> bishopBB &= ~bb;
            case PieceUtils.ROOK -> rookBB &= ~bb;
            case PieceUtils.QUEEN -> queenBB &= ~bb;
            case PieceUtils.KING -> kingBB &= ~bb;
            default -> {
                return;
            }
        }
        if(ColorUtils.isWhite(color)) {
            whiteBB &= ~bb;
        } else {
            blackBB &= ~bb;
        }
        gameBB &= ~bb;

        pieceAt[BitUtils.bitScanForward(bb)] = PieceUtils.NONE;
    }

    public void updateBBs(int startPosition, int endPosition, byte pieceType, int color) {
        removeFromBBs(BitUtils.getPositionIndexBitMask(startPosition), pieceType, color);
        addToBBs(BitUtils.getPositionIndexBitMask(endPosition), pieceType, color);
    }
}
