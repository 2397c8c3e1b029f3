package max.chess.rules.moves;

import max.chess.rules.common.CastleSide;
import max.chess.rules.common.Location;
import max.chess.rules.common.PieceType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class MoveTest {

    @Test
    public void longAlgebraicNotationShouldBeRead() {
        // When
        Move move = Move.fromAlgebraicNotation("e2e4");
        Move promotion = Move.fromAlgebraicNotation("a7a8q");

        // Then
        assertEquals(Location.of("e2"), move.start());
        assertEquals(Location.of("e4"), move.end());
        assert !move.isPromotion();
        assert promotion.promotion() == PieceType.QUEEN;
        assertEquals("a7a8q", promotion.toString());
    }

    @Test
    public void castleNotationShouldGiveACastle() {
        assertEquals(Move.castle(CastleSide.KING_SIDE), Move.fromAlgebraicNotation("O-O"));
        assertEquals(Move.castle(CastleSide.QUEEN_SIDE), Move.fromAlgebraicNotation("O-O-O"));
        assertEquals("O-O-O", Move.castle(CastleSide.QUEEN_SIDE).toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"e2", "e2e4e6", "O-O-O-O"})
    public void badLengthShouldBeRejected(String notation) {
        assertThrows(IllegalArgumentException.class, () -> Move.fromAlgebraicNotation(notation));
    }
}
