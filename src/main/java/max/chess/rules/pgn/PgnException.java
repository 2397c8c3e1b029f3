package max.chess.rules.pgn;

public class PgnException extends Exception {
    public PgnException(String message) {
        super(message);
    }

    public PgnException(String message, Throwable cause) {
        super(message, cause);
    }
}
