package max.chess.rules.moves.pieces;

import max.chess.rules.common.Color;
import max.chess.rules.common.Location;
import max.chess.rules.common.PieceType;
import max.chess.rules.game.Game;
import max.chess.rules.game.board.utils.BoardGenerator;
import org.junit.jupiter.api.Test;

public class PieceMovementTest {

    private static Piece at(Game game, String square) {
        return game.board().getPieceAt(Location.of(square));
    }

    @Test
    public void knightShouldJumpOverPieces() {
        // Given
        Game game = BoardGenerator.newStandardGameBoard();
        Piece knight = at(game, "b1");

        // Then
        assert knight.canMoveTo(Location.of("c3"), game);
        assert knight.canMoveTo(Location.of("a3"), game);
        assert !knight.canMoveTo(Location.of("b3"), game);
        assert !knight.canTake(Location.of("d2"), game);
    }

    @Test
    public void bishopShouldNeedAClearDiagonal() {
        // Given
        Game game = BoardGenerator.newStandardGameBoard();
        Piece bishop = at(game, "c1");

        // Then
        assert !bishop.canMoveTo(Location.of("e3"), game);

        // When
        game.removePieceAt(Location.of("d2"));

        // Then
        assert bishop.canMoveTo(Location.of("e3"), game);
        assert bishop.canMoveTo(Location.of("h6"), game);
        assert !bishop.canMoveTo(Location.of("c3"), game);
    }

    @Test
    public void rookShouldMoveAlongRanksAndFiles() {
        // Given
        Game game = BoardGenerator.from("4k3/8/8/8/3R4/8/8/4K3 w - - 0 1");
        Piece rook = at(game, "d4");

        // Then
        assert rook.canMoveTo(Location.of("d8"), game);
        assert rook.canMoveTo(Location.of("a4"), game);
        assert rook.canMoveTo(Location.of("h4"), game);
        assert !rook.canMoveTo(Location.of("e5"), game);
    }

    @Test
    public void queenShouldCombineRookAndBishop() {
        // Given
        Game game = BoardGenerator.from("4k3/8/8/8/3Q4/8/8/4K3 w - - 0 1");
        Piece queen = at(game, "d4");

        // Then
        assert queen.canMoveTo(Location.of("d8"), game);
        assert queen.canMoveTo(Location.of("h8"), game);
        assert queen.canMoveTo(Location.of("a1"), game);
        assert !queen.canMoveTo(Location.of("e6"), game);
    }

    @Test
    public void pawnShouldAdvanceOneOrTwoFromStart() {
        // Given
        Game game = BoardGenerator.newStandardGameBoard();
        Piece whitePawn = at(game, "e2");
        Piece blackPawn = at(game, "d7");

        // Then
        assert whitePawn.canMoveTo(Location.of("e3"), game);
        assert whitePawn.canMoveTo(Location.of("e4"), game);
        assert !whitePawn.canMoveTo(Location.of("e5"), game);
        assert !whitePawn.canMoveTo(Location.of("e1"), game);
        assert blackPawn.canMoveTo(Location.of("d5"), game);
        assert !blackPawn.canMoveTo(Location.of("d8"), game);
    }

    @Test
    public void pawnShouldNotAdvanceIntoOrThroughPieces() {
        // Given
        Game game = BoardGenerator.from("4k3/8/8/8/8/4n3/4P3/4K3 w - - 0 1");
        Piece pawn = at(game, "e2");

        // Then
        assert !pawn.canMoveTo(Location.of("e3"), game);
        assert !pawn.canMoveTo(Location.of("e4"), game);
        assert !pawn.canTake(Location.of("e3"), game);
    }

    @Test
    public void pawnAwayFromStartShouldOnlyAdvanceOne() {
        // Given
        Game game = BoardGenerator.from("4k3/8/8/8/8/4P3/8/4K3 w - - 0 1");
        Piece pawn = at(game, "e3");

        // Then
        assert pawn.canMoveTo(Location.of("e4"), game);
        assert !pawn.canMoveTo(Location.of("e5"), game);
    }

    @Test
    public void pawnShouldCaptureDiagonallyForward() {
        // Given
        Game game = BoardGenerator.from("4k3/8/8/3p4/4P3/8/8/4K3 w - - 0 1");
        Piece pawn = at(game, "e4");

        // Then
        assert pawn.canTake(Location.of("d5"), game);
        assert !pawn.canMoveTo(Location.of("d5"), game);
        assert !pawn.canTake(Location.of("f5"), game);
        assert pawn.attacks(Location.of("f5"), game.board(), null);
        assert !pawn.attacks(Location.of("e5"), game.board(), null);
    }

    @Test
    public void pawnShouldCaptureOntoEnPassantTarget() {
        // Given
        Game game = BoardGenerator.from("4k3/8/8/3pP3/8/8/8/4K3 w - d6 0 1");
        Piece pawn = at(game, "e5");

        // Then
        assert pawn.canTake(Location.of("d6"), game);
        assert !pawn.canTake(Location.of("f6"), game);

        // When
        game.setEnPassantTarget(null);

        // Then
        assert !pawn.canTake(Location.of("d6"), game);
    }

    @Test
    public void kingShouldNotStepOntoAttackedSquares() {
        // Given
        Game game = BoardGenerator.from("4k3/8/8/8/8/8/8/r3K3 w - - 0 1");
        Piece king = at(game, "e1");

        // Then
        assert !king.canMoveTo(Location.of("d1"), game);
        // f1 is only attacked through the square the king leaves
        assert !king.canMoveTo(Location.of("f1"), game);
        assert king.canMoveTo(Location.of("e2"), game);
        assert king.canMoveTo(Location.of("d2"), game);
        assert !king.canMoveTo(Location.of("e3"), game);
    }

    @Test
    public void kingShouldNotTakeADefendedPiece() {
        // Given
        Game undefended = BoardGenerator.from("4k3/8/8/8/8/8/3q4/4K3 w - - 0 1");
        Game defended = BoardGenerator.from("3rk3/8/8/8/8/8/3q4/4K3 w - - 0 1");

        // Then
        assert at(undefended, "e1").canTake(Location.of("d2"), undefended);
        assert !at(defended, "e1").canTake(Location.of("d2"), defended);
    }

    @Test
    public void moveShapeShouldIgnoreObstacles() {
        // Given
        Game game = BoardGenerator.newStandardGameBoard();

        // Then
        assert at(game, "a1").isInMoveShape(Location.of("a5"));
        assert !at(game, "a1").isInMoveShape(Location.of("b3"));
        assert at(game, "e2").isInMoveShape(Location.of("d3"));
    }

    @Test
    public void createShouldBuildEveryType() {
        for(PieceType type : PieceType.VALUES) {
            Piece piece = Piece.create(type, Color.BLACK);
            assert piece.type() == type;
            assert piece.color() == Color.BLACK;
            assert piece.isCaptured();
            assert !piece.hasMoved();
        }
    }
}
