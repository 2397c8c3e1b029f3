package max.chess.rules.pgn;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Splits a multi-game PGN file. Each game is a block of tag lines, a blank line, the movetext
 * (possibly over several lines) and a blank line. The last game may omit its trailing blank line.
 */
public final class PgnReader {
    private enum State { TAGS, AFTER_TAGS, MOVES }

    private PgnReader() {
    }

    public static List<PgnGame> read(Path file) throws IOException, PgnException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static List<PgnGame> read(String pgn) throws PgnException {
        try {
            return read(new StringReader(pgn));
        } catch (IOException e) {
            throw new PgnException("Cannot read PGN text", e);
        }
    }

    public static List<PgnGame> read(Reader source) throws IOException, PgnException {
        BufferedReader reader = new BufferedReader(source);
        List<PgnGame> games = new ObjectArrayList<>();
        StringBuilder game = new StringBuilder();
        State state = State.TAGS;
        int lineNumber = 0;
        String line;
        while((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if(trimmed.startsWith("[")) {
                if(state != State.TAGS) {
                    throw new PgnException("Line " + lineNumber + ": tag found while reading " + state + ", expected a blank line first");
                }
                game.append(trimmed).append('\n');
            } else if(trimmed.isEmpty()) {
                switch (state) {
                    case TAGS -> {
                        if(!game.isEmpty()) {
                            state = State.AFTER_TAGS;
                            game.append('\n');
                        }
                    }
                    case AFTER_TAGS -> throw new PgnException("Line " + lineNumber + ": second blank line after tags, movetext missing");
                    case MOVES -> {
                        games.add(PgnGame.parse(game.toString()));
                        game.setLength(0);
                        state = State.TAGS;
                    }
                }
            } else {
                state = State.MOVES;
                game.append(trimmed).append('\n');
            }
        }

        if(state == State.MOVES) {
            games.add(PgnGame.parse(game.toString()));
        } else if(!game.isEmpty()) {
            throw new PgnException("Game ending at line " + lineNumber + " has tags but no movetext");
        }
        return games;
    }
}
