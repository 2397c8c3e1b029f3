package max.chess.rules.moves.pieces;

import max.chess.rules.common.Color;
import max.chess.rules.common.Location;
import max.chess.rules.common.PieceType;
import max.chess.rules.game.Game;
import max.chess.rules.game.board.Board;

public final class Bishop extends Piece {

    public Bishop(Color color) {
        super(color, PieceType.BISHOP);
    }

    @Override
    public boolean isInMoveShape(Location destination) {
        if(location() == null || location().equals(destination)) {
            return false;
        }
        Location.Offset delta = deltaTo(destination);
        return delta.absFile() == delta.absRank();
    }

    @Override
    public boolean canMoveTo(Location destination, Game game) {
        return slides(destination, game.board(), null, false, true);
    }

    @Override
    public boolean attacks(Location square, Board board, Location vacated) {
        return slides(square, board, vacated, false, true);
    }
}
