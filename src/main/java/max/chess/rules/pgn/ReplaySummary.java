package max.chess.rules.pgn;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

public final class ReplaySummary {
    private final String title;
    private final List<ReplayResult> results;
    private final Object2IntOpenHashMap<String> failuresByKind = new Object2IntOpenHashMap<>();
    private int passed;

    public ReplaySummary(String title, List<ReplayResult> results) {
        this.title = title;
        this.results = Collections.unmodifiableList(new ObjectArrayList<>(results));
        for(ReplayResult result : results) {
            if(result.passed()) {
                passed++;
            } else {
                failuresByKind.addTo(result.failureKind(), 1);
            }
        }
    }

    public List<ReplayResult> results() {
        return results;
    }

    public int passed() {
        return passed;
    }

    public int failed() {
        return results.size() - passed;
    }

    public double passPercentage() {
        return results.isEmpty() ? 0.0 : passed * 100.0 / results.size();
    }

    public Object2IntMap<String> failuresByKind() {
        return failuresByKind;
    }

    public List<PgnGame> failedGames() {
        List<PgnGame> failedGames = new ObjectArrayList<>();
        for(ReplayResult result : results) {
            if(!result.passed()) {
                failedGames.add(result.game());
            }
        }
        return failedGames;
    }

    /** Per game PASS/FAIL lines under a title carrying the pass percentage. */
    public String toTable() {
        int width = "Game Name".length();
        for(ReplayResult result : results) {
            width = Math.max(width, result.game().vsString().length());
        }
        StringBuilder table = new StringBuilder();
        table.append(title).append('\n')
                .append(String.format(Locale.ROOT, "%.2f%%", passPercentage())).append('\n');
        table.append(String.format(Locale.ROOT, "%-" + width + "s | %s\n", "Game Name", "Result"));
        for(ReplayResult result : results) {
            String outcome = result.passed() ? "PASS" : "FAIL " + result.failureKind() + " at " + result.failedToken();
            table.append(String.format(Locale.ROOT, "%-" + width + "s | %s\n", result.game().vsString(), outcome));
        }
        table.append(passed).append(" passed, ").append(failed()).append(" failed");
        return table.toString();
    }

    @Override
    public String toString() {
        return title + ": " + passed + "/" + results.size() + " passed";
    }
}
