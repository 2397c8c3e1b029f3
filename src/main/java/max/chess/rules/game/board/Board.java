package max.chess.rules.game.board;

import max.chess.rules.common.Color;
import max.chess.rules.common.Location;
import max.chess.rules.moves.pieces.Piece;

import java.util.ArrayList;
import java.util.List;

public class Board {
    private final Piece[] pieceAt;

    public Board() {
        this.pieceAt = new Piece[64];
    }

    public Piece getPieceAt(Location location) {
        return pieceAt[location.getFlatIndex()];
    }

    public boolean isEmpty(Location location) {
        return pieceAt[location.getFlatIndex()] == null;
    }

    public boolean isOccupiedBy(Location location, Color color) {
        Piece piece = pieceAt[location.getFlatIndex()];
        return piece != null && piece.color() == color;
    }

    // Keeps the square table and the piece location in sync
    public void place(Piece piece, Location location) {
        if(pieceAt[location.getFlatIndex()] != null) {
            throw new IllegalStateException("Cannot place " + piece + " on " + location + ", already occupied by " + pieceAt[location.getFlatIndex()]);
        }
        pieceAt[location.getFlatIndex()] = piece;
        piece.setLocation(location);
    }

    public Piece remove(Location location) {
        Piece piece = pieceAt[location.getFlatIndex()];
        pieceAt[location.getFlatIndex()] = null;
        if(piece != null) {
            piece.setLocation(null);
        }
        return piece;
    }

    // Unconditional relocation, no rule is checked. Whatever stood on end is overwritten.
    public void forceMove(Location start, Location end) {
        Piece piece = pieceAt[start.getFlatIndex()];
        if(piece == null) {
            throw new IllegalStateException("No piece to force move at " + start);
        }
        pieceAt[start.getFlatIndex()] = null;
        pieceAt[end.getFlatIndex()] = piece;
        piece.setLocation(end);
    }

    /**
     * Squares strictly between start and end along a rank, a file or a diagonal.
     * Any other pair of squares has no intermediate squares.
     */
    public static List<Location> intermediateSquares(Location start, Location end) {
        Location.Offset delta = end.difference(start);
        List<Location> squares = new ArrayList<>(6);
        boolean straight = delta.fileDelta() == 0 || delta.rankDelta() == 0;
        boolean diagonal = delta.absFile() == delta.absRank();
        if(!straight && !diagonal) {
            return squares;
        }
        int stepX = Integer.signum(delta.fileDelta());
        int stepY = Integer.signum(delta.rankDelta());
        int distance = Math.max(delta.absFile(), delta.absRank());
        for(int i = 1; i < distance; i++) {
            squares.add(Location.of(start.x + i * stepX, start.y + i * stepY));
        }
        return squares;
    }

    public boolean isPathClear(Location start, Location end) {
        return isPathClear(start, end, null);
    }

    // vacated is treated as empty, e.g. the square a king is leaving
    public boolean isPathClear(Location start, Location end, Location vacated) {
        for(Location square : intermediateSquares(start, end)) {
            if(!square.equals(vacated) && !isEmpty(square)) {
                return false;
            }
        }
        return true;
    }

    public List<Piece> getPieces(Color color) {
        List<Piece> pieces = new ArrayList<>(16);
        for(Piece piece : pieceAt) {
            if(piece != null && piece.color() == color) {
                pieces.add(piece);
            }
        }
        return pieces;
    }

    public Piece[] copySquares() {
        return pieceAt.clone();
    }

    public void restoreSquares(Piece[] squares) {
        System.arraycopy(squares, 0, pieceAt, 0, 64);
    }

    /** 8x8 snapshot for rendering layers: row 0 is rank 8, column 0 is file a. FEN letters, '.' when empty. */
    public char[][] toGrid() {
        char[][] grid = new char[8][8];
        for(int rank = 7; rank >= 0; rank--) {
            for(int file = 0; file < 8; file++) {
                grid[7 - rank][file] = pieceCharAt(rank * 8 + file);
            }
        }
        return grid;
    }

    /** Returns an ASCII diagram of the board (ranks 8..1). */
    public String toAscii() {
        StringBuilder sb = new StringBuilder(8 * (8 + 4));
        for (int rank = 7; rank >= 0; rank--) {
            sb.append(rank + 1).append("  ");
            for (int file = 0; file < 8; file++) {
                sb.append(pieceCharAt(rank * 8 + file)).append(' ');
            }
            sb.append('\n');
        }
        sb.append("\n   a b c d e f g h");
        return sb.toString();
    }

    private char pieceCharAt(int sq) {
        Piece piece = pieceAt[sq];
        if (piece == null) return '.';
        return piece.type().fenLetter(piece.color());
    }

    @Override
    public String toString() {
        return toAscii();
    }
}
