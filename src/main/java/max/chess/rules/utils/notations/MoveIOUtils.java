package max.chess.rules.utils.notations;

import max.chess.rules.common.Color;
import max.chess.rules.common.PieceType;
import max.chess.rules.game.MovePlayed;
import max.chess.rules.moves.Move;

import java.util.List;

public class MoveIOUtils {
    public static String writeAlgebraicNotation(MovePlayed movePlayed) {
        String checkInfo = movePlayed.checkmate() ? "#" : movePlayed.check() ? "+" : "";
        if(movePlayed.castleKingSide()) {
            return "O-O" + checkInfo;
        }
        if(movePlayed.castleQueenSide()) {
            return "O-O-O" + checkInfo;
        }
        Move move = movePlayed.move();
        String algebraicNotationLetter = getAlgebraicNotationLetter(movePlayed.pieceType());
        String take = movePlayed.isCapture() ? "x" : "";
        String promotion = move.isPromotion() ? "=" + getAlgebraicNotationLetter(move.promotion()) : "";
        String enPassant = movePlayed.enPassant() ? " (e.p.)" : "";
        return algebraicNotationLetter + move.start() + take + move.end() + promotion + checkInfo + enPassant;
    }

    public static String writeAlgebraicNotation(Move move) {
        if(move.isCastle() && move.start() == null) {
            return move.castle().notation;
        }
        String promotedPiece = move.isPromotion() ? String.valueOf(Character.toLowerCase(move.promotion().letter)) : "";
        return move.start().toString() + move.end() + promotedPiece;
    }

    // "1. e2e4 e7e5 2. Ng1f3", a log starting with black gets "1... e7e5"
    public static String writeMoveLog(List<MovePlayed> moves) {
        StringBuilder log = new StringBuilder();
        for(MovePlayed movePlayed : moves) {
            if(movePlayed.color() == Color.WHITE) {
                log.append(movePlayed.turnNumber()).append(". ");
            } else if(log.isEmpty()) {
                log.append(movePlayed.turnNumber()).append("... ");
            }
            log.append(writeAlgebraicNotation(movePlayed)).append(' ');
        }
        return log.toString().trim();
    }

    private static String getAlgebraicNotationLetter(PieceType pieceType) {
        return pieceType == PieceType.PAWN ? "" : String.valueOf(pieceType.letter);
    }
}
