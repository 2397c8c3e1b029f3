package max.chess.rules.moves.pieces;

import max.chess.rules.common.Color;
import max.chess.rules.common.Location;
import max.chess.rules.common.PieceType;
import max.chess.rules.game.Game;
import max.chess.rules.game.board.Board;

public final class Pawn extends Piece {

    public Pawn(Color color) {
        super(color, PieceType.PAWN);
    }

    private boolean onStartRank() {
        return location().getRank() == color().pawnStartRank;
    }

    @Override
    public boolean isInMoveShape(Location destination) {
        if(location() == null) {
            return false;
        }
        Location.Offset delta = deltaTo(destination);
        int direction = color().direction;
        if(delta.fileDelta() == 0) {
            return delta.rankDelta() == direction || (delta.rankDelta() == 2 * direction && onStartRank());
        }
        return delta.absFile() == 1 && delta.rankDelta() == direction;
    }

    // Forward only, onto empty squares
    @Override
    public boolean canMoveTo(Location destination, Game game) {
        if(location() == null) {
            return false;
        }
        Location.Offset delta = deltaTo(destination);
        if(delta.fileDelta() != 0) {
            return false;
        }
        Board board = game.board();
        int direction = color().direction;
        if(delta.rankDelta() == direction) {
            return board.isEmpty(destination);
        }
        if(delta.rankDelta() == 2 * direction && onStartRank()) {
            return board.isPathClear(location(), destination) && board.isEmpty(destination);
        }
        return false;
    }

    @Override
    public boolean attacks(Location square, Board board, Location vacated) {
        if(location() == null) {
            return false;
        }
        Location.Offset delta = square.difference(location());
        return delta.absFile() == 1 && delta.rankDelta() == color().direction;
    }

    // Diagonal one square forward onto an enemy, or onto the en passant target
    @Override
    public boolean canTake(Location destination, Game game) {
        if(!attacks(destination, game.board(), null)) {
            return false;
        }
        Piece target = game.board().getPieceAt(destination);
        if(target != null) {
            return target.color() != color();
        }
        if(!destination.equals(game.getEnPassantTarget())) {
            return false;
        }
        Piece passed = game.board().getPieceAt(destination.offset(0, -color().direction));
        return passed != null && passed.type() == PieceType.PAWN && passed.color() != color();
    }

    @Override
    public void onMoved(Location start, Location end, Game game) {
        super.onMoved(start, end, game);
        if(Math.abs(end.getRank() - start.getRank()) == 2) {
            game.setEnPassantTarget(start.offset(0, color().direction));
        }
    }
}
