package max.chess.rules.common;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public enum CastleSide {
    KING_SIDE("O-O", 'K'),
    QUEEN_SIDE("O-O-O", 'Q');

    public record Squares(Location kingStart, Location kingEnd, Location rookStart, Location rookEnd) {
        // squares the king stands on, crosses and lands on
        public List<Location> kingPath() {
            int step = Integer.signum(kingEnd.x - kingStart.x);
            return List.of(kingStart, kingStart.offset(step, 0), kingEnd);
        }
    }

    private static final Map<Color, Map<CastleSide, Squares>> SQUARES = new EnumMap<>(Color.class);
    static {
        for(Color color : Color.values()) {
            int y = color.homeRank - 1;
            Map<CastleSide, Squares> bySide = new EnumMap<>(CastleSide.class);
            bySide.put(KING_SIDE, new Squares(Location.of(4, y), Location.of(6, y), Location.of(7, y), Location.of(5, y)));
            bySide.put(QUEEN_SIDE, new Squares(Location.of(4, y), Location.of(2, y), Location.of(0, y), Location.of(3, y)));
            SQUARES.put(color, bySide);
        }
    }

    public final String notation;
    public final char fenLetter;

    CastleSide(String notation, char fenLetter) {
        this.notation = notation;
        this.fenLetter = fenLetter;
    }

    public Squares squares(Color color) {
        return SQUARES.get(color).get(this);
    }

    public char fenLetter(Color color) {
        return color == Color.WHITE ? fenLetter : Character.toLowerCase(fenLetter);
    }
}
