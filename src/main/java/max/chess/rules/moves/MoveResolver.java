package max.chess.rules.moves;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import max.chess.rules.common.Color;
import max.chess.rules.common.Location;
import max.chess.rules.common.MoveError;
import max.chess.rules.common.MoveException;
import max.chess.rules.common.PieceType;
import max.chess.rules.game.Game;
import max.chess.rules.game.MoveResult;
import max.chess.rules.game.TempMove;
import max.chess.rules.moves.pieces.Piece;
import max.chess.rules.utils.notations.ParsedMove;
import max.chess.rules.utils.notations.SanParser;

import java.util.List;

/**
 * Turns a SAN token such as "Nf3", "exd5", "R1e2" or "O-O" into a concrete {@link Move} for the
 * player to move. Candidates are the player's pieces of the given type matching the optional
 * source file and rank that can reach the destination; each one is then played inside a rollback
 * scope and dropped when the game refuses it, which removes pinned pieces.
 */
public final class MoveResolver {

    private MoveResolver() {
    }

    public static Move resolve(Game game, String san) {
        ParsedMove parsed = SanParser.parse(san);
        if(parsed.isCastle()) {
            return Move.castle(parsed.castle());
        }

        Color color = game.getActivePlayer();
        Location destination = parsed.destination();
        PieceType promotion = parsed.promotion();
        if(promotion != null && (parsed.pieceType() != PieceType.PAWN || destination.getRank() != color.promotionRank)) {
            throw new MoveException(MoveError.PROMOTION_ERROR, "Cannot promote with " + san + ", only pawns reaching rank "
                    + color.promotionRank + " promote", List.of(destination), game.board().toAscii());
        }

        int fromFile = parsed.fromFile();
        int fromRank = parsed.fromRank();
        if(parsed.pieceType() == PieceType.KING && !parsed.hasSource()) {
            Piece king = game.getKing(color);
            if(king != null) {
                fromFile = king.location().x;
                fromRank = king.location().y;
            }
        }

        List<Piece> reaching = new ObjectArrayList<>();
        for(Piece piece : game.getPieces(color)) {
            Location location = piece.location();
            if(piece.type() != parsed.pieceType()
                    || (fromFile >= 0 && location.x != fromFile)
                    || (fromRank >= 0 && location.y != fromRank)) {
                continue;
            }
            if(reaches(piece, destination, parsed.capture(), game)) {
                reaching.add(piece);
            }
        }

        List<Move> legal = new ObjectArrayList<>(reaching.size());
        for(Piece piece : reaching) {
            Move candidate = new Move(piece.location(), destination, promotion);
            try (TempMove ignored = game.tempMove()) {
                MoveResult result = game.tryPlay(candidate);
                if(result.isSuccess()) {
                    legal.add(candidate);
                }
            }
        }

        if(legal.isEmpty()) {
            throw new MoveException(MoveError.NO_LEGAL_CANDIDATE, color.displayName() + " has no legal move for " + san,
                    List.of(destination), game.board().toAscii());
        }
        if(legal.size() > 1) {
            List<Location> squares = new ObjectArrayList<>();
            for(Move move : legal) {
                squares.add(move.start());
            }
            squares.add(destination);
            throw new MoveException(MoveError.AMBIGUOUS_MOVE, san + " is ambiguous, " + legal.size() + " pieces can play it",
                    squares, game.board().toAscii());
        }
        return legal.get(0);
    }

    // A capture onto an empty square is only an en passant capture
    private static boolean reaches(Piece piece, Location destination, boolean capture, Game game) {
        if(!capture) {
            return piece.canMoveTo(destination, game);
        }
        if(!game.board().isEmpty(destination)) {
            return piece.canTake(destination, game);
        }
        return piece.type() == PieceType.PAWN && destination.equals(game.getEnPassantTarget()) && piece.canTake(destination, game);
    }
}
