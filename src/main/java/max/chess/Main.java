package max.chess;

import max.chess.rules.pgn.PgnException;
import max.chess.rules.pgn.ReplayConfig;
import max.chess.rules.pgn.ReplayRunner;
import max.chess.rules.pgn.ReplaySummary;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class Main {
    static final String USAGE = "Usage: chess-rules <file.pgn> [--threads N] [--verbose] [--no-failed-file] [--fail-fast]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    // 0 when every game replays, 1 when some fail, 2 on bad usage or unreadable input
    static int run(String[] args, PrintStream out, PrintStream err) {
        Path file = null;
        ReplayConfig.Builder config = ReplayConfig.builder();
        try {
            for(int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--threads" -> {
                        if(i + 1 >= args.length) {
                            throw new IllegalArgumentException("--threads needs a value");
                        }
                        config.threads(Integer.parseInt(args[++i]));
                    }
                    case "--verbose" -> config.verbose(true);
                    case "--no-failed-file" -> config.writeFailedGames(false);
                    case "--fail-fast" -> config.failFast(true);
                    default -> {
                        if(args[i].startsWith("--") || file != null) {
                            throw new IllegalArgumentException("Unexpected argument " + args[i]);
                        }
                        file = Paths.get(args[i]);
                    }
                }
            }
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 2;
        }
        if(file == null || !Files.isRegularFile(file)) {
            err.println(file == null ? "Missing PGN file" : "No such file " + file);
            err.println(USAGE);
            return 2;
        }

        ReplayRunner runner = new ReplayRunner(config.build(), err::println);
        try {
            ReplaySummary summary = runner.run(file);
            out.println(summary.toTable());
            return summary.failed() == 0 ? 0 : 1;
        } catch (IOException | PgnException e) {
            err.println("Cannot replay " + file + ": " + e.getMessage());
            return 2;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted while replaying " + file);
            return 2;
        }
    }
}
