package max.chess.rules.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class LocationTest {

    @Test
    public void locationShouldParseCaseInsensitively() {
        // When
        Location upper = Location.of("E4");
        Location lower = Location.of("e4");

        // Then
        assert upper.equals(lower);
        assert upper.hashCode() == lower.hashCode();
        assert lower.x == 4;
        assert lower.getRank() == 4;
        assertEquals("e4", upper.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"i1", "a9", "a0", "e", "e44", "", "4e"})
    public void locationShouldRejectInvalidSquares(String square) {
        // When
        MoveException exception = assertThrows(MoveException.class, () -> Location.of(square));

        // Then
        assert exception.kind() == MoveError.INVALID_SQUARE;
    }

    @Test
    public void differenceShouldBeSignedFileAndRankDeltas() {
        // Given
        Location b1 = Location.of("b1");
        Location c3 = Location.of("c3");

        // When
        Location.Offset forward = c3.difference(b1);
        Location.Offset backward = b1.difference(c3);

        // Then
        assertEquals(new Location.Offset(1, 2), forward);
        assertEquals(new Location.Offset(-1, -2), backward);
    }

    @Test
    public void offsetShouldMoveWithinTheBoard() {
        // Given
        Location e2 = Location.of("e2");

        // Then
        assertEquals(Location.of("e4"), e2.offset(0, 2));
        assertEquals(Location.of("d3"), e2.offset(new Location.Offset(-1, 1)));
        assert e2.canOffset(3, 6);
        assert !e2.canOffset(4, 0);
    }

    @Test
    public void offsetOffTheBoardShouldFail() {
        // Given
        Location h8 = Location.of("h8");

        // When
        MoveException exception = assertThrows(MoveException.class, () -> h8.offset(1, 0));

        // Then
        assert exception.kind() == MoveError.INVALID_SQUARE;
    }

    @Test
    public void flatIndexShouldRoundTrip() {
        for(Location location : Location.all()) {
            assert Location.of(location.getFlatIndex()) == location;
        }
        assert Location.all().size() == 64;
        assert Location.of("a1").getFlatIndex() == 0;
        assert Location.of("h8").getFlatIndex() == 63;
    }
}
