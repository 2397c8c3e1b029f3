package max.chess.rules.common;

public enum Color {
    WHITE(1, 1, 2, 8, 'w'),
    BLACK(-1, 8, 7, 1, 'b');

    // +1 when pawns advance towards rank 8
    public final int direction;
    public final int homeRank;
    public final int pawnStartRank;
    public final int promotionRank;
    public final char fenLetter;

    Color(int direction, int homeRank, int pawnStartRank, int promotionRank, char fenLetter) {
        this.direction = direction;
        this.homeRank = homeRank;
        this.pawnStartRank = pawnStartRank;
        this.promotionRank = promotionRank;
        this.fenLetter = fenLetter;
    }

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    public String displayName() {
        return this == WHITE ? "White" : "Black";
    }

    public static Color fromFenLetter(String letter) {
        return switch (letter) {
            case "w" -> WHITE;
            case "b" -> BLACK;
            default -> throw new IllegalArgumentException("Unknown active color " + letter);
        };
    }
}
