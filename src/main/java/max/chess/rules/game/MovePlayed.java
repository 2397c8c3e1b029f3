package max.chess.rules.game;

import max.chess.rules.common.CastleSide;
import max.chess.rules.common.Color;
import max.chess.rules.common.PieceType;
import max.chess.rules.moves.Move;
import max.chess.rules.utils.notations.MoveIOUtils;

// One applied ply as kept in the move log. pieceEaten is null when nothing was captured.
public record MovePlayed(int turnNumber, Color color, PieceType pieceType, Move move, boolean enPassant,
                         PieceType pieceEaten, boolean check, boolean checkmate) {

    public boolean castleKingSide() {
        return move.castle() == CastleSide.KING_SIDE;
    }

    public boolean castleQueenSide() {
        return move.castle() == CastleSide.QUEEN_SIDE;
    }

    public boolean isCapture() {
        return pieceEaten != null;
    }

    @Override
    public String toString() {
        return MoveIOUtils.writeAlgebraicNotation(this);
    }
}
