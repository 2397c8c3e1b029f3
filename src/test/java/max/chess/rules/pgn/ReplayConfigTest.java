package max.chess.rules.pgn;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class ReplayConfigTest {

    @Test
    public void defaultsShouldWriteFailedGamesQuietly() {
        ReplayConfig config = ReplayConfig.defaults();
        assert config.threads >= 1;
        assert !config.verbose;
        assert config.writeFailedGames;
        assert !config.failFast;
    }

    @Test
    public void toBuilderShouldCopyEverySetting() {
        // Given
        ReplayConfig config = ReplayConfig.builder().threads(5).verbose(true).writeFailedGames(false).failFast(true).build();

        // When
        ReplayConfig copy = config.toBuilder().build();

        // Then
        assert copy.threads == 5;
        assert copy.verbose;
        assert !copy.writeFailedGames;
        assert copy.failFast;
    }

    @Test
    public void threadsShouldBePositive() {
        assertThrows(IllegalArgumentException.class, () -> ReplayConfig.builder().threads(0));
    }
}
