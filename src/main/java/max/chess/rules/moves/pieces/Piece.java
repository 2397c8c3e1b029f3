package max.chess.rules.moves.pieces;

import max.chess.rules.common.Color;
import max.chess.rules.common.Location;
import max.chess.rules.common.PieceType;
import max.chess.rules.game.Game;
import max.chess.rules.game.board.Board;

/**
 * A chess man and its movement rules. Every variant answers three questions about a destination:
 * can it go there when the square is empty ({@link #canMoveTo}), can it capture what stands there
 * ({@link #canTake}) and does it attack that square at all ({@link #attacks}). None of them mutate the game.
 */
public abstract class Piece {
    private final Color color;
    private final PieceType type;
    private Location location;
    private boolean hasMoved;

    protected Piece(Color color, PieceType type) {
        this.color = color;
        this.type = type;
    }

    public static Piece create(PieceType type, Color color) {
        return switch (type) {
            case PAWN -> new Pawn(color);
            case KNIGHT -> new Knight(color);
            case BISHOP -> new Bishop(color);
            case ROOK -> new Rook(color);
            case QUEEN -> new Queen(color);
            case KING -> new King(color);
        };
    }

    /** Geometry and path clearance towards a destination, regardless of what occupies it. */
    public abstract boolean canMoveTo(Location destination, Game game);

    /**
     * Whether this piece would capture on square if an enemy stood there.
     * The vacated square, when not null, is considered empty.
     */
    public abstract boolean attacks(Location square, Board board, Location vacated);

    // Raw move shape, obstacles ignored
    public abstract boolean isInMoveShape(Location destination);

    public boolean canTake(Location destination, Game game) {
        if(location == null) {
            return false;
        }
        Piece target = game.board().getPieceAt(destination);
        return target != null && target.color != color && attacks(destination, game.board(), null);
    }

    public void onMoved(Location start, Location end, Game game) {
        hasMoved = true;
        game.setEnPassantTarget(null);
    }

    protected boolean slides(Location destination, Board board, Location vacated, boolean straight, boolean diagonal) {
        if(location == null || location.equals(destination)) {
            return false;
        }
        Location.Offset delta = destination.difference(location);
        boolean shape = (straight && (delta.fileDelta() == 0 || delta.rankDelta() == 0))
                || (diagonal && delta.absFile() == delta.absRank());
        return shape && board.isPathClear(location, destination, vacated);
    }

    protected Location.Offset deltaTo(Location destination) {
        return destination.difference(location);
    }

    public Color color() {
        return color;
    }

    public PieceType type() {
        return type;
    }

    public int value() {
        return type.value;
    }

    public Location location() {
        return location;
    }

    public void setLocation(Location location) {
        this.location = location;
    }

    public boolean hasMoved() {
        return hasMoved;
    }

    public void setHasMoved(boolean hasMoved) {
        this.hasMoved = hasMoved;
    }

    public boolean isCaptured() {
        return location == null;
    }

    @Override
    public String toString() {
        String name = type.name().charAt(0) + type.name().substring(1).toLowerCase();
        return color.displayName() + " " + name + (location == null ? "" : "@" + location);
    }
}
