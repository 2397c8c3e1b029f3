package max.chess.rules.moves.pieces;

import max.chess.rules.common.Color;
import max.chess.rules.common.Location;
import max.chess.rules.common.PieceType;
import max.chess.rules.game.Game;
import max.chess.rules.game.board.Board;

/**
 * One square in any direction, never onto a square the opponent attacks. The king's own square is
 * considered empty while probing, so a slider checking along a line still covers the square behind it.
 * Castling is not part of the king geometry, the game handles it.
 */
public final class King extends Piece {

    public King(Color color) {
        super(color, PieceType.KING);
    }

    @Override
    public boolean isInMoveShape(Location destination) {
        if(location() == null) {
            return false;
        }
        Location.Offset delta = deltaTo(destination);
        return Math.max(delta.absFile(), delta.absRank()) == 1;
    }

    @Override
    public boolean canMoveTo(Location destination, Game game) {
        return isInMoveShape(destination) && !isAttackedFrom(destination, game);
    }

    @Override
    public boolean attacks(Location square, Board board, Location vacated) {
        return isInMoveShape(square);
    }

    @Override
    public boolean canTake(Location destination, Game game) {
        return super.canTake(destination, game) && !isAttackedFrom(destination, game);
    }

    private boolean isAttackedFrom(Location destination, Game game) {
        return game.isSquareAttacked(destination, color().getOppositeColor(), location());
    }
}
