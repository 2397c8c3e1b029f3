package max.chess.rules.common;

import java.util.List;
import java.util.Locale;

public final class Location {

    public record Offset(int fileDelta, int rankDelta) {
        public int absFile() {
            return Math.abs(fileDelta);
        }

        public int absRank() {
            return Math.abs(rankDelta);
        }
    }

    private static final Location[] LOCATION_CACHE = new Location[64];
    static {
        for(int i = 0; i < 64; i++) {
            LOCATION_CACHE[i] = new Location(i % 8, i / 8);
        }
    }

    // x: file index in [0,7] (a..h), y: rank index in [0,7] (1..8)
    public final int x;
    public final int y;

    private Location(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public static boolean isOnBoard(int x, int y) {
        return x >= 0 && x < 8 && y >= 0 && y < 8;
    }

    public static Location of(int x, int y) {
        if(!isOnBoard(x, y)) {
            throw new MoveException(MoveError.INVALID_SQUARE, "Square (" + x + "," + y + ") is off the board");
        }
        return LOCATION_CACHE[x + 8 * y];
    }

    public static Location of(int flatIndex) {
        if(flatIndex < 0 || flatIndex > 63) {
            throw new MoveException(MoveError.INVALID_SQUARE, "Square index " + flatIndex + " is off the board");
        }
        return LOCATION_CACHE[flatIndex];
    }

    public static Location of(String square) {
        if(square == null || square.length() != 2) {
            throw new MoveException(MoveError.INVALID_SQUARE, "Square should be format 'a1', not " + square);
        }
        String lower = square.toLowerCase(Locale.ROOT);
        char file = lower.charAt(0);
        char rank = lower.charAt(1);
        if(file < 'a' || file > 'h' || rank < '1' || rank > '8') {
            throw new MoveException(MoveError.INVALID_SQUARE, "Invalid square: " + square);
        }
        return LOCATION_CACHE[(file - 'a') + 8 * (rank - '1')];
    }

    public static List<Location> all() {
        return List.of(LOCATION_CACHE);
    }

    public Offset difference(Location other) {
        return new Offset(x - other.x, y - other.y);
    }

    public Location offset(int fileDelta, int rankDelta) {
        return Location.of(x + fileDelta, y + rankDelta);
    }

    public Location offset(Offset offset) {
        return offset(offset.fileDelta(), offset.rankDelta());
    }

    public boolean canOffset(int fileDelta, int rankDelta) {
        return isOnBoard(x + fileDelta, y + rankDelta);
    }

    public char getFile() {
        return (char) ('a' + x);
    }

    public int getRank() {
        return y + 1;
    }

    public int getFlatIndex() {
        return x + 8 * y;
    }

    @Override
    // Locations are cached, one instance per square
    public boolean equals(Object obj) {
        return obj == this;
    }

    @Override
    public int hashCode() {
        return getFlatIndex();
    }

    @Override
    public String toString() {
        return "" + getFile() + getRank();
    }
}
