package max.chess.quiz.utils.notations;

import max.chess.quiz.common.PieceType;
import max.chess.quiz.game.Game;
import max.chess.quiz.movegen.Move;
import max.chess.quiz.utils.BitUtils;
import max.chess.quiz.utils.PieceUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class MoveIOUtils {
    // piece, from file, from rank, capture, target, promotion
    private static final Pattern SAN_PATTERN =
            Pattern.compile("^([NBRQK])?([a-h])?([1-8])?(x)?([a-h][1-8])(?:=?([NBRQ]))?$");

    private MoveIOUtils() {
    }

    public static String getSquareFromPosition(int positionIndex) {
        if(positionIndex < 0 || positionIndex > 63) {
            throw new IllegalArgumentException("position index should be in [0-63], got " + positionIndex);
        }
        return String.valueOf((char) ('a' + BitUtils.file(positionIndex))) + (char) ('1' + BitUtils.rank(positionIndex));
    }

    public static int getPositionFromSquare(String square) {
        if(square == null || square.length() != 2) {
            throw new IllegalArgumentException("square should be format 'a1', got " + square);
        }
        char file = square.charAt(0);
        char rank = square.charAt(1);
        if(file < 'a' || file > 'h') {
            throw new IllegalArgumentException("square letter should be in [a-h], got " + square);
        }
        if(rank < '1' || rank > '8') {
            throw new IllegalArgumentException("square digit should be in [1-8], got " + square);
        }
        return (rank - '1') * 8 + (file - 'a');
    }

    // Long algebraic notation such as e2e4 or e7e8q
    public static String toUCINotation(int move) {
        String promotion = Move.getPromotion(move) == PieceUtils.NONE
                ? ""
                : String.valueOf(PieceUtils.toPieceType(Move.getPromotion(move)).letter());
        return getSquareFromPosition(Move.getStartPosition(move)) + getSquareFromPosition(Move.getEndPosition(move)) + promotion;
    }

    /**
     * Writes the standard algebraic notation of {@code move}, including the check or mate suffix.
     *
     * @param game the position the move is played from
     * @param move a legal move of that position
     * @param legalMoves every legal move of that position, used for disambiguation
     */
    public static String writeSan(Game game, int move, int[] legalMoves) {
        Game after = game.copy();
        after.playMove(move);
        return writeSan(game, move, legalMoves, after);
    }

    // Same as writeSan, when the caller already holds the position reached after the move
    public static String writeSan(Game game, int move, int[] legalMoves, Game after) {
        String suffix = "";
        if(after.inCheck()) {
            suffix = after.getLegalMovesCount() == 0 ? "#" : "+";
        }
        return writeSanWithoutSuffix(game, move, legalMoves) + suffix;
    }

    public static String writeSanWithoutSuffix(Game game, int move, int[] legalMoves) {
        if(Move.isCastleKingSide(move)) {
            return "O-O";
        }
        if(Move.isCastleQueenSide(move)) {
            return "O-O-O";
        }

        byte pieceType = Move.getPieceType(move);
        int startPosition = Move.getStartPosition(move);
        int endPosition = Move.getEndPosition(move);
        boolean capture = Move.isCapture(move);

        StringBuilder san = new StringBuilder();
        if(pieceType == PieceUtils.PAWN) {
            if(capture) {
                san.append((char) ('a' + BitUtils.file(startPosition)));
            }
        } else {
            san.append(PieceUtils.toPieceType(pieceType).sanLetter());
            san.append(disambiguation(move, legalMoves));
        }
        if(capture) {
            san.append('x');
        }
        san.append(getSquareFromPosition(endPosition));
        if(Move.getPromotion(move) != PieceUtils.NONE) {
            san.append('=').append(PieceUtils.toPieceType(Move.getPromotion(move)).sanLetter());
        }
        return san.toString();
    }

    private static String disambiguation(int move, int[] legalMoves) {
        int startPosition = Move.getStartPosition(move);
        boolean ambiguous = false;
        boolean sameFile = false;
        boolean sameRank = false;
        for(int other : legalMoves) {
            int otherStart = Move.getStartPosition(other);
            if(otherStart == startPosition
                    || Move.getPieceType(other) != Move.getPieceType(move)
                    || Move.getEndPosition(other) != Move.getEndPosition(move)) {
                continue;
            }
            ambiguous = true;
            if(BitUtils.file(otherStart) == BitUtils.file(startPosition)) {
                sameFile = true;
            }
            if(BitUtils.rank(otherStart) == BitUtils.rank(startPosition)) {
                sameRank = true;
            }
        }

        if(!ambiguous) {
            return "";
        }
        String square = getSquareFromPosition(startPosition);
        if(!sameFile) {
            return square.substring(0, 1);
        }
        if(!sameRank) {
            return square.substring(1, 2);
        }
        return square;
    }

    /**
     * Finds the legal move of {@code game} a SAN token designates.
     *
     * @throws IllegalArgumentException if the token is malformed, designates no legal move or several of them
     */
    public static int resolveSan(Game game, String token) {
        int[] legalMoves = game.getLegalMoves();
        String san = stripAnnotations(token);

        if("O-O".equals(san) || "0-0".equals(san)) {
            return findCastle(legalMoves, true, token);
        }
        if("O-O-O".equals(san) || "0-0-0".equals(san)) {
            return findCastle(legalMoves, false, token);
        }

        Matcher matcher = SAN_PATTERN.matcher(san);
        if(!matcher.matches()) {
            throw new IllegalArgumentException("Malformed SAN move '" + token + "'");
        }
        byte pieceType = matcher.group(1) == null ? PieceUtils.PAWN : PieceType.fromLetter(matcher.group(1).charAt(0)).toBytes();
        int fromFile = matcher.group(2) == null ? -1 : matcher.group(2).charAt(0) - 'a';
        int fromRank = matcher.group(3) == null ? -1 : matcher.group(3).charAt(0) - '1';
        int endPosition = getPositionFromSquare(matcher.group(5));
        byte promotion = matcher.group(6) == null ? PieceUtils.NONE : PieceType.fromLetter(matcher.group(6).charAt(0)).toBytes();

        int found = -1;
        for(int move : legalMoves) {
            int startPosition = Move.getStartPosition(move);
            if(Move.getPieceType(move) != pieceType
                    || Move.getEndPosition(move) != endPosition
                    || Move.getPromotion(move) != promotion
                    || Move.isCastleKingSide(move) || Move.isCastleQueenSide(move)
                    || (fromFile != -1 && BitUtils.file(startPosition) != fromFile)
                    || (fromRank != -1 && BitUtils.rank(startPosition) != fromRank)) {
                continue;
            }
            if(found != -1) {
                throw new IllegalArgumentException("Ambiguous SAN move '" + token + "'");
            }
            found = move;
        }
        if(found == -1) {
            throw new IllegalArgumentException("Illegal SAN move '" + token + "' in " + game.toFEN());
        }
        return found;
    }

    private static int findCastle(int[] legalMoves, boolean kingSide, String token) {
        for(int move : legalMoves) {
            if(kingSide ? Move.isCastleKingSide(move) : Move.isCastleQueenSide(move)) {
                return move;
            }
        }
        throw new IllegalArgumentException("Illegal castle '" + token + "'");
    }

    private static String stripAnnotations(String token) {
        int end = token.length();
        while(end > 0 && "+#!?".indexOf(token.charAt(end - 1)) != -1) {
            end--;
        }
        return token.substring(0, end);
    }
}
