package max.chess.rules.utils.notations;

import max.chess.rules.common.CastleSide;
import max.chess.rules.common.Location;
import max.chess.rules.common.MoveError;
import max.chess.rules.common.MoveException;
import max.chess.rules.common.PieceType;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Standard algebraic notation, annotation glyphs (!, ?) are tolerated and ignored
public class SanParser {
    private static final Pattern MOVE = Pattern.compile(
            "^(?<piece>[KQRBN])?(?<fromFile>[a-h])?(?<fromRank>[1-8])?(?<capture>x)?(?<to>[a-h][1-8])"
                    + "(?:=?(?<promotion>[QRBN]))?(?<suffix>[+#])?[!?]*$");
    private static final Pattern CASTLE = Pattern.compile("^(?<side>O-O-O|0-0-0|O-O|0-0)(?<suffix>[+#])?[!?]*$");

    public static ParsedMove parse(String san) {
        String text = san == null ? "" : san.trim();

        Matcher castle = CASTLE.matcher(text);
        if(castle.matches()) {
            CastleSide side = castle.group("side").length() == 5 ? CastleSide.QUEEN_SIDE : CastleSide.KING_SIDE;
            String suffix = castle.group("suffix");
            return ParsedMove.castle(text, side, "+".equals(suffix), "#".equals(suffix));
        }

        Matcher move = MOVE.matcher(text);
        if(!move.matches()) {
            throw new MoveException(MoveError.INVALID_SQUARE, "Cannot read move '" + san + "'");
        }
        String piece = move.group("piece");
        String fromFile = move.group("fromFile");
        String fromRank = move.group("fromRank");
        String promotion = move.group("promotion");
        String suffix = move.group("suffix");
        return new ParsedMove(text,
                piece == null ? PieceType.PAWN : PieceType.fromLetter(piece.charAt(0)),
                fromFile == null ? -1 : fromFile.charAt(0) - 'a',
                fromRank == null ? -1 : fromRank.charAt(0) - '1',
                move.group("capture") != null,
                Location.of(move.group("to")),
                promotion == null ? null : PieceType.fromLetter(promotion.charAt(0)),
                null,
                "+".equals(suffix),
                "#".equals(suffix));
    }
}
