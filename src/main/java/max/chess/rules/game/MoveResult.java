package max.chess.rules.game;

import max.chess.rules.common.Location;
import max.chess.rules.common.MoveError;
import max.chess.rules.common.MoveException;

import java.util.List;

/**
 * Outcome of an attempted move: either the ply that was played, or why it was refused.
 * Probing code inspects the error kind, callers that want an exception use {@link #orElseThrow()}.
 */
public record MoveResult(MovePlayed played, MoveError error, String message, List<Location> squares, String board) {

    public static MoveResult success(MovePlayed played) {
        return new MoveResult(played, null, null, List.of(), null);
    }

    public static MoveResult failure(MoveError error, String message, List<Location> squares, String board) {
        return new MoveResult(null, error, message, List.copyOf(squares), board);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public MovePlayed orElseThrow() {
        if(error != null) {
            throw asException();
        }
        return played;
    }

    public MoveException asException() {
        if(error == null) {
            throw new IllegalStateException("Move succeeded: " + played);
        }
        return new MoveException(error, message, squares, board);
    }
}
