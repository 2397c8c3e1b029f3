package max.chess.rules.common;

public enum PieceType {
    PAWN('P', 1),
    KNIGHT('N', 3),
    BISHOP('B', 3),
    ROOK('R', 5),
    QUEEN('Q', 9),
    KING('K', 100);

    public static final PieceType[] VALUES = PieceType.values();

    // Upper case SAN / FEN letter, FEN lower-cases it for black
    public final char letter;
    public final int value;

    PieceType(char letter, int value) {
        this.letter = letter;
        this.value = value;
    }

    public boolean isPromotionTarget() {
        return this == KNIGHT || this == BISHOP || this == ROOK || this == QUEEN;
    }

    public char fenLetter(Color color) {
        return color == Color.WHITE ? letter : Character.toLowerCase(letter);
    }

    public static PieceType fromLetter(char letter) {
        return switch (Character.toUpperCase(letter)) {
            case 'P' -> PAWN;
            case 'N' -> KNIGHT;
            case 'B' -> BISHOP;
            case 'R' -> ROOK;
            case 'Q' -> QUEEN;
            case 'K' -> KING;
            default -> throw new IllegalArgumentException("Unknown piece letter " + letter);
        };
    }
}
