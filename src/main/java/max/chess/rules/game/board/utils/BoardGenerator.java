package max.chess.rules.game.board.utils;

import max.chess.rules.game.Game;
import max.chess.rules.utils.notations.FENUtils;

import java.util.function.Consumer;

public class BoardGenerator {
    public static final String STANDARD_GAME = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";
    public static final String TEST_CASTLING_GAME = "r3k2r/pppppppp/8/8/8/8/PPPPPPPP/R3K2R w KQkq - 0 1";

    public static Game newStandardGameBoard() {
        return FENUtils.getBoardFrom(STANDARD_GAME);
    }

    public static Game newStandardGameBoard(Consumer<String> log) {
        return FENUtils.getBoardFrom(STANDARD_GAME, log);
    }

    public static Game from(String FEN) {
        return FENUtils.getBoardFrom(FEN);
    }
}
