package max.chess.rules.moves;

import max.chess.rules.common.CastleSide;
import max.chess.rules.common.Location;
import max.chess.rules.common.PieceType;
import max.chess.rules.utils.notations.MoveIOUtils;

/**
 * A concrete move: start and end squares plus an optional promotion, or a castle.
 * A castle built with {@link #castle(CastleSide)} has no squares, they depend on the side to move.
 */
public record Move(Location start, Location end, PieceType promotion, CastleSide castle) {

    public Move(Location start, Location end) {
        this(start, end, null, null);
    }

    public Move(Location start, Location end, PieceType promotion) {
        this(start, end, promotion, null);
    }

    public static Move castle(CastleSide side) {
        return new Move(null, null, null, side);
    }

    public static Move promote(Location start, Location end, PieceType pieceType) {
        return new Move(start, end, pieceType);
    }

    // Long algebraic form such as e2e4 or a7a8q, O-O and O-O-O are accepted too
    public static Move fromAlgebraicNotation(String notation) {
        if(CastleSide.KING_SIDE.notation.equals(notation)) {
            return castle(CastleSide.KING_SIDE);
        }
        if(CastleSide.QUEEN_SIDE.notation.equals(notation)) {
            return castle(CastleSide.QUEEN_SIDE);
        }
        if(notation.length() != 4 && notation.length() != 5) {
            throw new IllegalArgumentException("Cannot parse algebraic notation " + notation);
        }
        Location start = Location.of(notation.substring(0, 2));
        Location end = Location.of(notation.substring(2, 4));
        if (notation.length() == 4) {
            return new Move(start, end);
        }
        return Move.promote(start, end, PieceType.fromLetter(notation.charAt(4)));
    }

    public boolean isCastle() {
        return castle != null;
    }

    public boolean isPromotion() {
        return promotion != null;
    }

    @Override
    public String toString() {
        return MoveIOUtils.writeAlgebraicNotation(this);
    }
}
