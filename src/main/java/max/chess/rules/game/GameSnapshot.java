package max.chess.rules.game;

import it.unimi.dsi.fastutil.objects.Reference2ObjectOpenHashMap;
import max.chess.rules.common.Color;
import max.chess.rules.common.Location;
import max.chess.rules.moves.pieces.Piece;

import java.util.List;

/**
 * Everything a move can change, copied field by field. Pieces are mutable, so the location and
 * has-moved flag of every piece alive or captured at snapshot time are kept aside as well.
 */
record GameSnapshot(Piece[] squares,
                    List<Piece> whitePieces, List<Piece> blackPieces,
                    List<Piece> whiteCaptured, List<Piece> blackCaptured,
                    Reference2ObjectOpenHashMap<Piece, PieceState> pieceStates,
                    Color activePlayer, int turnNumber, int halfMoveClock,
                    Location enPassantTarget, int moveCount) {

    record PieceState(Location location, boolean hasMoved) {}

    static void record(Reference2ObjectOpenHashMap<Piece, PieceState> states, List<Piece> pieces) {
        for(Piece piece : pieces) {
            states.put(piece, new PieceState(piece.location(), piece.hasMoved()));
        }
    }

    void restorePieces() {
        for(var entry : pieceStates.reference2ObjectEntrySet()) {
            entry.getKey().setLocation(entry.getValue().location());
            entry.getKey().setHasMoved(entry.getValue().hasMoved());
        }
    }
}
