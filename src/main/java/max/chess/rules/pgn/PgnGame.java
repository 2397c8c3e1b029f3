package max.chess.rules.pgn;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One game of a PGN file: its tag pairs and the SAN tokens of its movetext. Move numbers,
 * results, annotations and {comments} are dropped. Tag names are kept lower-cased in file order.
 */
public final class PgnGame {
    private static final Pattern TAG = Pattern.compile("\\[(\\w+) \"(.*)\"\\]");
    private static final Pattern COMMENT = Pattern.compile("\\{.*?\\}", Pattern.DOTALL);
    private static final Pattern MOVE_TOKEN = Pattern.compile("(?:[NBRQK]?[a-h]?[1-8]?x?[a-h][1-8](?:=?[NBRQ])?|O-O-O|O-O)[+#]?");

    private final String text;
    private final Object2ObjectLinkedOpenHashMap<String, String> tags;
    private final List<String> moves;

    private PgnGame(String text, Object2ObjectLinkedOpenHashMap<String, String> tags, List<String> moves) {
        this.text = text;
        this.tags = tags;
        this.moves = moves;
    }

    public static PgnGame parse(String text) {
        Object2ObjectLinkedOpenHashMap<String, String> tags = new Object2ObjectLinkedOpenHashMap<>();
        StringBuilder movetext = new StringBuilder();
        for(String line : text.split("\\R")) {
            String trimmed = line.trim();
            if(trimmed.startsWith("[")) {
                Matcher tag = TAG.matcher(trimmed);
                if(tag.matches()) {
                    tags.put(tag.group(1).toLowerCase(Locale.ROOT), tag.group(2));
                }
                continue;
            }
            movetext.append(trimmed).append('\n');
        }

        List<String> moves = new ObjectArrayList<>();
        Matcher token = MOVE_TOKEN.matcher(COMMENT.matcher(movetext).replaceAll(" "));
        while(token.find()) {
            moves.add(token.group());
        }
        return new PgnGame(text, tags, Collections.unmodifiableList(moves));
    }

    public String tag(String name) {
        return tags.get(name.toLowerCase(Locale.ROOT));
    }

    public Map<String, String> tags() {
        return Collections.unmodifiableMap(tags);
    }

    public List<String> moves() {
        return moves;
    }

    // Starting position of a game set up from a FEN tag, null for the standard start
    public String startFen() {
        return tag("fen");
    }

    public String vsString() {
        return orUnknown(tag("white")) + " v. " + orUnknown(tag("black"));
    }

    public String text() {
        return text;
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "?" : value;
    }

    @Override
    public String toString() {
        return vsString() + " (" + moves.size() + " plies)";
    }
}
