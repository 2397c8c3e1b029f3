package max.chess.rules.common;

import java.util.List;

/**
 * Raised for every rule violation the engine detects. Carries the error kind, the squares
 * involved and, when a game was at hand, an ASCII diagram of the board at the time of failure.
 */
public class MoveException extends RuntimeException {
    private final MoveError kind;
    private final List<Location> squares;
    private final String board;

    public MoveException(MoveError kind, String message) {
        this(kind, message, List.of(), null);
    }

    public MoveException(MoveError kind, String message, List<Location> squares, String board) {
        super(message);
        this.kind = kind;
        this.squares = List.copyOf(squares);
        this.board = board;
    }

    public MoveError kind() {
        return kind;
    }

    public List<Location> squares() {
        return squares;
    }

    public String board() {
        return board;
    }

    public String diagnostic() {
        if(board == null) {
            return kind + ": " + getMessage();
        }
        return kind + ": " + getMessage() + "\n" + board;
    }
}
