package max.chess.rules.pgn;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ReplayRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    public void resultsShouldKeepInputOrder() throws Exception {
        // Given
        List<PgnGame> games = PgnReader.read(PgnTestResources.sample());
        ReplayRunner runner = new ReplayRunner(ReplayConfig.builder().threads(3).writeFailedGames(false).build(), s -> {});

        // When
        ReplaySummary summary = runner.run("sample", games);

        // Then
        assert summary.results().size() == 4;
        for(int i = 0; i < games.size(); i++) {
            assert summary.results().get(i).game() == games.get(i);
        }
        assert summary.passed() == 3;
        assert summary.failed() == 1;
        assertEquals(75.0, summary.passPercentage());
        assert summary.failuresByKind().getInt("NO_LEGAL_CANDIDATE") == 1;
        assertEquals("Eve v. Mallory", summary.failedGames().get(0).vsString());
    }

    @Test
    public void tableShouldListEveryGame() throws Exception {
        // Given
        ReplayRunner runner = new ReplayRunner(ReplayConfig.builder().threads(1).build(), s -> {});

        // When
        String table = runner.run("sample.pgn", PgnReader.read(PgnTestResources.sample())).toTable();

        // Then
        assert table.startsWith("sample.pgn\n75.00%\n");
        assert table.contains("FAIL NO_LEGAL_CANDIDATE at Ke3");
        assert table.contains("Alice v. Bob");
        assert table.endsWith("3 passed, 1 failed");
    }

    @Test
    public void failedGamesShouldBeWrittenNextToTheInput() throws Exception {
        // Given
        Path file = tempDir.resolve("sample.pgn");
        Files.writeString(file, PgnTestResources.sample(), StandardCharsets.UTF_8);
        ReplayRunner runner = new ReplayRunner(ReplayConfig.builder().threads(2).build(), s -> {});

        // When
        runner.run(file);

        // Then
        Path failed = tempDir.resolve("sample-failed.pgn");
        assert Files.exists(failed);
        List<PgnGame> failedGames = PgnReader.read(failed);
        assert failedGames.size() == 1;
        assertEquals("Eve v. Mallory", failedGames.get(0).vsString());
        assertEquals(List.of("e4", "e5", "Ke3", "Nf6"), failedGames.get(0).moves());
    }

    @Test
    public void failedFileNameShouldBeDerivedFromTheInput() {
        assertEquals(tempDir.resolve("games-failed.pgn"), ReplayRunner.failedFileFor(tempDir.resolve("games.pgn")));
        assertEquals(tempDir.resolve("games-failed.pgn"), ReplayRunner.failedFileFor(tempDir.resolve("games-failed.pgn")));
    }

    @Test
    public void verboseRunShouldPrefixLinesWithTheGameNumber() throws Exception {
        // Given
        List<String> lines = Collections.synchronizedList(new ArrayList<>());
        ReplayRunner runner = new ReplayRunner(ReplayConfig.builder().threads(2).verbose(true).build(), lines::add);

        // When
        runner.run("sample", PgnReader.read(PgnTestResources.sample()));

        // Then
        assert lines.contains("[1] Replaying Alice v. Bob");
        assert lines.contains("[1] 4. Qh5xf7#");
        assert lines.stream().anyMatch(line -> line.startsWith("[3] Failed on Ke3"));
    }

    @Test
    public void failFastShouldStopAtTheFirstFailure() throws Exception {
        // Given
        ReplayRunner runner = new ReplayRunner(ReplayConfig.builder().threads(1).failFast(true).build(), s -> {});

        // When
        ReplaySummary summary = runner.run("sample", PgnReader.read(PgnTestResources.sample()));

        // Then
        assert summary.results().size() == 3;
        assert summary.failed() == 1;
    }
}
