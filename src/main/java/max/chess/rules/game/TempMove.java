package max.chess.rules.game;

/**
 * Rollback scope: everything played inside is undone on close.
 * <pre>
 * try (TempMove scope = game.tempMove()) {
 *     game.tryMove(start, end);
 *     inCheck = game.isInCheck(color);
 * }
 * </pre>
 * Nested scopes must be closed in reverse order of opening.
 */
public final class TempMove implements AutoCloseable {
    private final Game game;
    private final GameSnapshot snapshot;
    private boolean closed;

    TempMove(Game game, GameSnapshot snapshot) {
        this.game = game;
        this.snapshot = snapshot;
    }

    GameSnapshot snapshot() {
        return snapshot;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if(closed) {
            return;
        }
        game.closeScope(this);
        closed = true;
    }
}
