package max.chess.rules.moves.pieces;

import max.chess.rules.common.Color;
import max.chess.rules.common.Location;
import max.chess.rules.common.PieceType;
import max.chess.rules.game.Game;
import max.chess.rules.game.board.Board;

// has-moved is what castling rights are derived from
public final class Rook extends Piece {

    public Rook(Color color) {
        super(color, PieceType.ROOK);
    }

    @Override
    public boolean isInMoveShape(Location destination) {
        if(location() == null || location().equals(destination)) {
            return false;
        }
        Location.Offset delta = deltaTo(destination);
        return delta.fileDelta() == 0 || delta.rankDelta() == 0;
    }

    @Override
    public boolean canMoveTo(Location destination, Game game) {
        return slides(destination, game.board(), null, true, false);
    }

    @Override
    public boolean attacks(Location square, Board board, Location vacated) {
        return slides(square, board, vacated, true, false);
    }
}
