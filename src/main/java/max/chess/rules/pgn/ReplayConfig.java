package max.chess.rules.pgn;

public final class ReplayConfig {

    public final int threads;
    public final boolean verbose;
    // Failed games are written next to the input as <name>-failed.pgn
    public final boolean writeFailedGames;
    // Stop collecting results after the first failed game
    public final boolean failFast;

    private ReplayConfig(Builder b) {
        threads = b.threads;
        verbose = b.verbose;
        writeFailedGames = b.writeFailedGames;
        failFast = b.failFast;
    }

    public static ReplayConfig defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().threads(threads).verbose(verbose).writeFailedGames(writeFailedGames).failFast(failFast);
    }

    @Override
    public String toString() {
        return "ReplayConfig{threads=" + threads + ", verbose=" + verbose + ", writeFailedGames=" + writeFailedGames + ", failFast=" + failFast + "}";
    }

    public static class Builder {
        private int threads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        private boolean verbose = false;
        private boolean writeFailedGames = true;
        private boolean failFast = false;

        public Builder threads(int v){
            if(v < 1) {
                throw new IllegalArgumentException("threads must be at least 1, got " + v);
            }
            threads=v;return this;
        }
        public Builder verbose(boolean v){verbose=v;return this;}
        public Builder writeFailedGames(boolean v){writeFailedGames=v;return this;}
        public Builder failFast(boolean v){failFast=v;return this;}

        public ReplayConfig build(){return new ReplayConfig(this);}
    }
}
