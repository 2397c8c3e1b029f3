package max.chess.rules.utils.notations;

import max.chess.rules.common.CastleSide;
import max.chess.rules.common.Location;
import max.chess.rules.common.PieceType;

/**
 * A SAN token split into its parts. fromFile and fromRank are 0-based, -1 when the token gives no
 * disambiguation. A castle token only carries its side and check markers.
 */
public record ParsedMove(String text, PieceType pieceType, int fromFile, int fromRank, boolean capture,
                         Location destination, PieceType promotion, CastleSide castle,
                         boolean check, boolean checkmate) {

    public static ParsedMove castle(String text, CastleSide side, boolean check, boolean checkmate) {
        return new ParsedMove(text, PieceType.KING, -1, -1, false, null, null, side, check, checkmate);
    }

    public boolean isCastle() {
        return castle != null;
    }

    public boolean hasSource() {
        return fromFile >= 0 || fromRank >= 0;
    }
}
