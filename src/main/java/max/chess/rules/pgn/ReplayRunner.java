package max.chess.rules.pgn;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Replays many PGN games, one fresh game per task on a fixed pool. Games share nothing, so results
 * only need collecting, in input order.
 */
public final class ReplayRunner {
    private final ReplayConfig config;
    private final Consumer<String> out;

    public ReplayRunner(ReplayConfig config, Consumer<String> out) {
        this.config = config;
        this.out = out;
    }

    public ReplaySummary run(Path file) throws IOException, PgnException, InterruptedException {
        List<PgnGame> games = PgnReader.read(file);
        out.accept("Loaded " + games.size() + " games from " + file);
        ReplaySummary summary = run(file.getFileName().toString(), games);
        if(config.writeFailedGames) {
            Path failedFile = failedFileFor(file);
            writeGames(failedFile, summary.failedGames());
            out.accept(summary.failed() + " failed games written to " + failedFile);
        }
        return summary;
    }

    public ReplaySummary run(String title, List<PgnGame> games) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(config.threads, new ReplayThreadFactory());
        try {
            List<Future<ReplayResult>> futures = new ObjectArrayList<>(games.size());
            for(int i = 0; i < games.size(); i++) {
                PgnGame game = games.get(i);
                Consumer<String> gameLog = config.verbose ? prefixed(i + 1) : s -> {};
                futures.add(executor.submit(() -> PgnReplay.replay(game, gameLog)));
            }

            List<ReplayResult> results = new ObjectArrayList<>(games.size());
            for(int i = 0; i < futures.size(); i++) {
                ReplayResult result = collect(futures.get(i), games.get(i));
                results.add(result);
                if(config.failFast && !result.passed()) {
                    out.accept("Stopping after first failure: " + result.game().vsString());
                    break;
                }
            }
            return new ReplaySummary(title, results);
        } finally {
            executor.shutdownNow();
        }
    }

    // A replay only fails through ReplayResult, anything thrown is an engine bug reported as a crash
    private ReplayResult collect(Future<ReplayResult> future, PgnGame game) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            out.accept("Replay of " + game.vsString() + " crashed: " + cause);
            return ReplayResult.failed(game, 0, "?", null, String.valueOf(cause), null);
        }
    }

    private Consumer<String> prefixed(int gameNumber) {
        return line -> out.accept("[" + gameNumber + "] " + line);
    }

    // game.pgn gives game-failed.pgn, a file already named *failed* is rewritten in place
    static Path failedFileFor(Path file) {
        String name = file.getFileName().toString();
        if(name.contains("failed")) {
            return file;
        }
        String base = name.toLowerCase().endsWith(".pgn") ? name.substring(0, name.length() - 4) : name;
        return file.resolveSibling(base + "-failed.pgn");
    }

    static void writeGames(Path file, List<PgnGame> games) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for(PgnGame game : games) {
                writer.write(game.text().strip());
                writer.write("\n\n");
            }
        }
    }

    private static final class ReplayThreadFactory implements ThreadFactory {
        private final AtomicInteger index = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "pgn-replay-" + index.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
