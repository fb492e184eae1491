package max.chess.quiz.utils.notations;

import max.chess.quiz.common.PieceType;
import max.chess.quiz.game.Game;
import max.chess.quiz.utils.BitUtils;
import max.chess.quiz.utils.ColorUtils;
import max.chess.quiz.utils.PieceUtils;

// https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
public final class FENUtils {

    public static Game getBoardFrom(String fen) {
        Game game = new Game();
        String[] fenFields = fen.trim().split("\\s+");

        if(fenFields.length != 6) {
            throw new IllegalArgumentException("Invalid FEN record: " + fen);
        }

        injectPiecePlacement(game, fenFields[0]);
        injectCurrentTurn(game, fenFields[1]);
        injectCastlingRights(game, fenFields[2]);
        injectEnPassantSquare(game, fenFields[3]);
        game.halfMoveClock = parseCounter(fenFields[4], fen);
        game.fullMoveClock = parseCounter(fenFields[5], fen);

        return game;
    }

    public static String getFENFromBoard(Game game) {
        StringBuilder fen = new StringBuilder();
        injectPiecePlacement(game, fen);
        fen.append(' ').append(ColorUtils.isBlack(game.currentPlayer) ? 'b' : 'w');
        injectCastlingRights(game, fen);
        injectEnPassantSquare(game, fen);
        fen.append(' ').append(game.halfMoveClock);
        fen.append(' ').append(game.fullMoveClock);
        return fen.toString();
    }

    private static void injectEnPassantSquare(Game game, StringBuilder fen) {
        fen.append(' ');
        int enPassantIndex = game.board().enPassantIndex;
        if(enPassantIndex != -1) {
            fen.append(MoveIOUtils.getSquareFromPosition(enPassantIndex));
        } else {
            fen.append('-');
        }
    }

    private static void injectCastlingRights(Game game, StringBuilder fen) {
        fen.append(' ');
        StringBuilder castlingRights = new StringBuilder();
        if(game.whiteCanCastleKingSide) {
            castlingRights.append("K");
        }
        if(game.whiteCanCastleQueenSide) {
            castlingRights.append("Q");
        }
        if(game.blackCanCastleKingSide) {
            castlingRights.append("k");
        }
        if(game.blackCanCastleQueenSide) {
            castlingRights.append("q");
        }

        if(castlingRights.isEmpty()) {
            fen.append('-');
        } else {
            fen.append(castlingRights);
        }
    }

    private static void injectPiecePlacement(Game game, StringBuilder fen) {
        for(int rank = 7 ; rank >= 0 ; rank--) {
            int emptySpaceCounter = 0;
            if(rank != 7) {
                fen.append('/');
            }
            for(int file = 0 ; file < 8 ; file++) {
                int positionIndex = rank * 8 + file;
                byte pieceType = game.board().getPieceTypeAt(positionIndex);
                if(pieceType == PieceUtils.NONE) {
                    emptySpaceCounter++;
                    continue;
                }

                if(emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                char letter = PieceUtils.toPieceType(pieceType).letter();
                fen.append(ColorUtils.isWhite(game.board().getColorAt(positionIndex)) ? Character.toUpperCase(letter) : letter);
            }

            if(emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
    }

    private static int parseCounter(String counter, String fen) {
        try {
            return Integer.parseInt(counter);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid move counter '" + counter + "' in FEN record: " + fen, e);
        }
    }

    private static void injectEnPassantSquare(Game game, String enPassantSquare) {
        if("-".equals(enPassantSquare)) {
            game.board().enPassantIndex = -1;
        } else {
            game.board().enPassantIndex = MoveIOUtils.getPositionFromSquare(enPassantSquare);
        }
    }

    private static void injectCastlingRights(Game game, String castlingRights) {
        game.whiteCanCastleKingSide = castlingRights.indexOf('K') != -1;
        game.whiteCanCastleQueenSide = castlingRights.indexOf('Q') != -1;
        game.blackCanCastleKingSide = castlingRights.indexOf('k') != -1;
        game.blackCanCastleQueenSide = castlingRights.indexOf('q') != -1;
    }

    private static void injectCurrentTurn(Game game, String currentTurn) {
        game.currentPlayer = switch (currentTurn) {
            case "w" -> ColorUtils.WHITE;
            case "b" -> ColorUtils.BLACK;
            default -> throw new IllegalArgumentException("Invalid side to move " + currentTurn);
        };
    }

    private static void injectPiecePlacement(Game game, String piecePlacement) {
        String[] piecePlacementRows = piecePlacement.split("/");
        if(piecePlacementRows.length != 8) {
            throw new IllegalArgumentException("Invalid piece placement " + piecePlacement);
        }
        for(int row = 0; row < 8; row++) {
            int rank = 7 - row;
            int file = 0;
            for(char character : piecePlacementRows[row].toCharArray()) {
                if(character >= '1' && character <= '8') {
                    file += character - '0';
                    continue;
                }
                if(file > 7) {
                    throw new IllegalArgumentException("Too many squares on rank " + (rank + 1) + " in " + piecePlacement);
                }
                PieceType pieceType = PieceType.fromLetter(character);
                int color = Character.isUpperCase(character) ? ColorUtils.WHITE : ColorUtils.BLACK;
                game.board().addToBBs(BitUtils.getPositionIndexBitMask(rank * 8 + file), pieceType.toBytes(), color);
                file++;
            }
            if(file != 8) {
                throw new IllegalArgumentException("Rank " + (rank + 1) + " does not describe 8 squares in " + piecePlacement);
            }
        }
    }
}
