package max.chess.rules.utils.notations;

import max.chess.rules.common.CastleSide;
import max.chess.rules.common.Color;
import max.chess.rules.common.Location;
import max.chess.rules.common.PieceType;
import max.chess.rules.game.Game;
import max.chess.rules.moves.pieces.Piece;

import java.util.function.Consumer;

// FEN Visualizer: https://www.redhotpawn.com/chess/chess-fen-viewer.php
public class FENUtils {

    // https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
    public static Game getBoardFrom(String FEN) {
        return getBoardFrom(FEN, s -> {});
    }

    public static Game getBoardFrom(String FEN, Consumer<String> log) {
        String[] fenFields = FEN.trim().split("\\s+");
        if(fenFields.length != 6) {
            throw new IllegalArgumentException("Invalid FEN record " + FEN);
        }

        Game game = new Game(log);
        injectPiecePlacement(game, fenFields[0]);
        injectCurrentTurn(game, fenFields[1]);
        injectCastlingRights(game, fenFields[2]);
        injectEnPassantSquare(game, fenFields[3]);
        injectHalfMoveClock(game, fenFields[4]);
        injectFullMoveNumber(game, fenFields[5]);
        return game;
    }

    /**
     * Castling rights are derived from unmoved kings and rooks on their home squares.
     * The en passant field is always written as '-'.
     */
    public static String getFENFromBoard(Game game) {
        StringBuilder fen = new StringBuilder();
        injectPiecePlacement(game, fen);
        injectCurrentTurn(game, fen);
        injectCastlingRights(game, fen);
        fen.append(" -");
        injectHalfMoveClock(game, fen);
        injectFullMoveNumber(game, fen);
        return fen.toString();
    }

    private static void injectHalfMoveClock(Game game, StringBuilder fen) {
        fen.append(' ').append(game.getHalfMoveClock());
    }

    private static void injectCastlingRights(Game game, StringBuilder fen) {
        fen.append(' ');
        StringBuilder castlingRights = new StringBuilder();
        for(Color color : Color.values()) {
            for(CastleSide side : CastleSide.values()) {
                if(game.hasCastlingRights(color, side)) {
                    castlingRights.append(side.fenLetter(color));
                }
            }
        }

        if(castlingRights.isEmpty()) {
            fen.append('-');
        } else {
            fen.append(castlingRights);
        }
    }

    private static void injectCurrentTurn(Game game, StringBuilder fen) {
        fen.append(' ').append(game.getActivePlayer().fenLetter);
    }

    private static void injectPiecePlacement(Game game, StringBuilder fen) {
        char[][] grid = game.board().toGrid();
        for(int row = 0; row < 8; row++) {
            int emptySpaceCounter = 0;
            if(row != 0) {
                fen.append('/');
            }
            for(char square : grid[row]) {
                if(square == '.') {
                    emptySpaceCounter++;
                    continue;
                }
                if(emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                fen.append(square);
            }
            if(emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
    }

    private static void injectFullMoveNumber(Game game, StringBuilder fen) {
        fen.append(' ').append(game.getTurnNumber());
    }

    private static void injectFullMoveNumber(Game game, String fullMoveNumber) {
        game.setTurnNumber(Integer.parseInt(fullMoveNumber));
    }

    private static void injectHalfMoveClock(Game game, String halfMoveClock) {
        game.setHalfMoveClock(Integer.parseInt(halfMoveClock));
    }

    private static void injectEnPassantSquare(Game game, String enPassantSquare) {
        game.setEnPassantTarget("-".equals(enPassantSquare) ? null : Location.of(enPassantSquare));
    }

    // Rights are not stored, a missing right marks the matching king or rook as moved
    private static void injectCastlingRights(Game game, String castlingRights) {
        for(Color color : Color.values()) {
            boolean anyRight = false;
            for(CastleSide side : CastleSide.values()) {
                boolean right = castlingRights.indexOf(side.fenLetter(color)) >= 0;
                anyRight |= right;
                Piece rook = game.board().getPieceAt(side.squares(color).rookStart());
                if(rook != null && rook.type() == PieceType.ROOK && rook.color() == color) {
                    rook.setHasMoved(!right);
                }
            }
            Piece king = game.getKing(color);
            if(king != null) {
                king.setHasMoved(!anyRight || !king.location().equals(CastleSide.KING_SIDE.squares(color).kingStart()));
            }
        }
    }

    private static void injectCurrentTurn(Game game, String currentTurn) {
        game.setActivePlayer(Color.fromFenLetter(currentTurn));
    }

    private static void injectPiecePlacement(Game game, String piecePlacement) {
        String[] piecePlacementRows = piecePlacement.split("/");
        if(piecePlacementRows.length != 8) {
            throw new IllegalArgumentException("Invalid FEN piece placement " + piecePlacement);
        }
        int currentRow = 8;
        for(String piecePlacementRow : piecePlacementRows) {
            int currentCol = 1;
            for(char character : piecePlacementRow.toCharArray()) {
                switch (character) {
                    case '1','2','3','4','5','6','7','8' -> currentCol += character - '0';
                    default -> {
                        Color color = Character.isUpperCase(character) ? Color.WHITE : Color.BLACK;
                        game.addPiece(PieceType.fromLetter(character), color, Location.of(currentCol - 1, currentRow - 1));
                        currentCol++;
                    }
                }
            }
            currentRow--;
        }
    }
}
