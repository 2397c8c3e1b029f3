package max.chess.rules.pgn;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class PgnGameTest {

    private static final String SICILIAN = "[Event \"Open\"]\n"
            + "[White \"Fischer, R.\"]\n"
            + "[Black \"Spassky, B.\"]\n"
            + "[Result \"1/2-1/2\"]\n"
            + "\n"
            + "1. e4 {a comment\n"
            + "mentioning e5 over two lines} c5 2. Nf3 d6 3. d4 cxd4 4. Nxd4 Nf6\n"
            + "5. Nc3 a6 1/2-1/2\n";

    @Test
    public void tagsShouldBeLowerCasedInFileOrder() {
        // When
        PgnGame game = PgnGame.parse(SICILIAN);

        // Then
        assertEquals(List.of("event", "white", "black", "result"), List.copyOf(game.tags().keySet()));
        assertEquals("Fischer, R.", game.tag("White"));
        assertEquals("1/2-1/2", game.tag("result"));
        assertEquals("Fischer, R. v. Spassky, B.", game.vsString());
        assert game.startFen() == null;
    }

    @Test
    public void movesShouldSkipNumbersCommentsAndResult() {
        // When
        PgnGame game = PgnGame.parse(SICILIAN);

        // Then
        assertEquals(List.of("e4", "c5", "Nf3", "d6", "d4", "cxd4", "Nxd4", "Nf6", "Nc3", "a6"), game.moves());
    }

    @Test
    public void castlesPromotionsAndSuffixesShouldBeKept() {
        // When
        PgnGame game = PgnGame.parse("1. O-O-O O-O 2. e8=Q+ Rxe8 3. Qh4xe1# 0-1");

        // Then
        assertEquals(List.of("O-O-O", "O-O", "e8=Q+", "Rxe8", "Qh4xe1#"), game.moves());
        assertEquals("? v. ?", game.vsString());
    }
}
