package max.chess.rules.pgn;

import max.chess.rules.common.MoveException;
import max.chess.rules.game.Game;
import max.chess.rules.game.MovePlayed;
import max.chess.rules.game.board.utils.BoardGenerator;
import max.chess.rules.utils.notations.FENUtils;

import java.util.function.Consumer;

// Plays the tokens of a PGN game one by one on a fresh game
public final class PgnReplay {

    private PgnReplay() {
    }

    public static ReplayResult replay(PgnGame pgnGame) {
        return replay(pgnGame, s -> {});
    }

    public static ReplayResult replay(PgnGame pgnGame, Consumer<String> log) {
        Game game;
        try {
            game = pgnGame.startFen() == null
                    ? BoardGenerator.newStandardGameBoard(log)
                    : FENUtils.getBoardFrom(pgnGame.startFen(), log);
        } catch (IllegalArgumentException | MoveException e) {
            return ReplayResult.failed(pgnGame, 0, null, null, "Cannot set up " + pgnGame.vsString() + ": " + e.getMessage(), null);
        }

        log.accept("Replaying " + pgnGame.vsString());
        int plies = 0;
        MovePlayed last = null;
        for(String token : pgnGame.moves()) {
            try {
                last = game.makeCompactMove(token);
            } catch (MoveException e) {
                log.accept("Failed on " + token + ": " + e.diagnostic());
                return ReplayResult.failed(pgnGame, plies, token, e.kind(), e.getMessage(), FENUtils.getFENFromBoard(game));
            }
            plies++;
        }
        return ReplayResult.passed(pgnGame, plies, last != null && last.checkmate(), FENUtils.getFENFromBoard(game));
    }
}
