package max.chess.rules.moves.pieces;

import max.chess.rules.common.Color;
import max.chess.rules.common.Location;
import max.chess.rules.common.PieceType;
import max.chess.rules.game.Game;
import max.chess.rules.game.board.Board;

public final class Knight extends Piece {

    public Knight(Color color) {
        super(color, PieceType.KNIGHT);
    }

    // Jumps, nothing in between matters
    @Override
    public boolean isInMoveShape(Location destination) {
        if(location() == null) {
            return false;
        }
        Location.Offset delta = deltaTo(destination);
        return (delta.absFile() == 1 && delta.absRank() == 2) || (delta.absFile() == 2 && delta.absRank() == 1);
    }

    @Override
    public boolean canMoveTo(Location destination, Game game) {
        return isInMoveShape(destination);
    }

    @Override
    public boolean attacks(Location square, Board board, Location vacated) {
        return isInMoveShape(square);
    }
}
