package max.chess.rules.game;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.Reference2ObjectOpenHashMap;
import max.chess.rules.common.CastleSide;
import max.chess.rules.common.Color;
import max.chess.rules.common.Location;
import max.chess.rules.common.MoveError;
import max.chess.rules.common.PieceType;
import max.chess.rules.game.board.Board;
import max.chess.rules.moves.Move;
import max.chess.rules.moves.MoveResolver;
import max.chess.rules.moves.pieces.Piece;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

public class Game {
    private static final int[][] KING_NEIGHBOURS = {
            {-1, -1}, {-1, 0}, {-1, 1}, {0, -1}, {0, 1}, {1, -1}, {1, 0}, {1, 1}
    };

    private final Board board = new Board();
    private final ObjectArrayList<Piece> whitePieces = new ObjectArrayList<>(16);
    private final ObjectArrayList<Piece> blackPieces = new ObjectArrayList<>(16);
    // Keyed by the color of the captured piece
    private final ObjectArrayList<Piece> whiteCaptured = new ObjectArrayList<>(16);
    private final ObjectArrayList<Piece> blackCaptured = new ObjectArrayList<>(16);
    private final ObjectArrayList<MovePlayed> moveLog = new ObjectArrayList<>();
    private final Deque<TempMove> scopes = new ArrayDeque<>();
    private final Consumer<String> log;

    private Color activePlayer = Color.WHITE;
    private int turnNumber = 1;
    private int halfMoveClock = 0;
    private Location enPassantTarget;

    public Game() {
        this(s -> {});
    }

    public Game(Consumer<String> log) {
        this.log = log;
    }

    public Board board() {
        return board;
    }

    public Piece addPiece(PieceType type, Color color, Location location) {
        Piece piece = Piece.create(type, color);
        addPiece(piece, location);
        return piece;
    }

    public void addPiece(Piece piece, Location location) {
        board.place(piece, location);
        registry(piece.color()).add(piece);
    }

    // Takes a piece off the board without recording a capture
    public Piece removePieceAt(Location location) {
        Piece piece = board.remove(location);
        if(piece != null) {
            registry(piece.color()).remove(piece);
        }
        return piece;
    }

    public MovePlayed move(String start, String end) {
        return move(Location.of(start), Location.of(end));
    }

    public MovePlayed move(Location start, Location end) {
        return tryMove(start, end, null).orElseThrow();
    }

    public MovePlayed move(Location start, Location end, PieceType promotion) {
        return tryMove(start, end, promotion).orElseThrow();
    }

    public MovePlayed play(Move move) {
        return tryPlay(move).orElseThrow();
    }

    public MovePlayed makeCompactMove(String san) {
        return play(MoveResolver.resolve(this, san));
    }

    // Space separated long algebraic moves, e.g. "e2e4 e7e5 g1f3"
    public List<MovePlayed> playMoves(String moves) {
        return playMoves(Arrays.stream(moves.trim().split("\\s+")).toList());
    }

    public List<MovePlayed> playMoves(List<String> moveList) {
        List<MovePlayed> played = new ObjectArrayList<>(moveList.size());
        for(String move : moveList) {
            played.add(play(Move.fromAlgebraicNotation(move)));
        }
        return played;
    }

    public MoveResult tryPlay(Move move) {
        if(move.isCastle()) {
            return tryCastle(move.castle());
        }
        return tryMove(move.start(), move.end(), move.promotion());
    }

    public MoveResult tryMove(Location start, Location end, PieceType promotion) {
        Piece piece = board.getPieceAt(start);
        if(piece == null) {
            return failure(MoveError.EMPTY_SOURCE, "There is no piece at " + start, start);
        }
        if(piece.color() != activePlayer) {
            return failure(MoveError.WRONG_TURN_OWNER, activePlayer.displayName() + " cannot move " + piece + ", it is not their piece", start);
        }
        if(start.equals(end)) {
            return failure(MoveError.ILLEGAL_GEOMETRY, piece + " cannot stay on its own square", start);
        }
        // e1g1 style castling
        if(piece.type() == PieceType.KING && promotion == null) {
            for(CastleSide side : CastleSide.values()) {
                CastleSide.Squares squares = side.squares(piece.color());
                if(start.equals(squares.kingStart()) && end.equals(squares.kingEnd())) {
                    return tryCastle(side);
                }
            }
        }
        if(promotion != null) {
            MoveResult refused = checkPromotion(piece, end, promotion);
            if(refused != null) {
                return refused;
            }
        }

        Piece target = board.getPieceAt(end);
        boolean enPassant = false;
        if(target != null) {
            if(target.color() == piece.color()) {
                return failure(MoveError.ILLEGAL_CAPTURE, piece + " cannot take its own " + target, start, end);
            }
            if(!piece.canTake(end, this)) {
                return refuse(piece, start, end);
            }
        } else if(piece.type() == PieceType.PAWN && end.equals(enPassantTarget) && start.x != end.x) {
            if(!piece.canTake(end, this)) {
                return refuse(piece, start, end);
            }
            enPassant = true;
            target = board.getPieceAt(end.offset(0, -piece.color().direction));
        } else if(!piece.canMoveTo(end, this)) {
            return refuse(piece, start, end);
        }

        GameSnapshot before = snapshot();
        if(target != null) {
            capture(target);
        }
        board.forceMove(start, end);
        piece.onMoved(start, end, this);
        if(promotion != null) {
            promote(piece, promotion);
        }

        if(isInCheck(piece.color())) {
            restore(before);
            return failure(MoveError.SELF_CHECK, piece + " cannot go to " + end + ", it would leave the " + piece.color().displayName() + " King in check", start, end);
        }
        return finalizeMove(piece.type(), new Move(start, end, promotion), enPassant, target == null ? null : target.type());
    }

    private MoveResult tryCastle(CastleSide side) {
        Color color = activePlayer;
        CastleSide.Squares squares = side.squares(color);
        if(!hasCastlingRights(color, side)) {
            return failure(MoveError.ILLEGAL_CASTLE, color.displayName() + " cannot castle " + side.notation + ", King or Rook has moved", squares.kingStart(), squares.rookStart());
        }
        if(!board.isPathClear(squares.kingStart(), squares.rookStart())) {
            return failure(MoveError.ILLEGAL_CASTLE, color.displayName() + " cannot castle " + side.notation + ", pieces stand between King and Rook", squares.kingStart(), squares.rookStart());
        }
        for(Location square : squares.kingPath()) {
            if(isSquareAttacked(square, color.getOppositeColor(), null)) {
                return failure(MoveError.ILLEGAL_CASTLE, color.displayName() + " cannot castle " + side.notation + ", " + square + " is attacked", square);
            }
        }

        Piece king = board.getPieceAt(squares.kingStart());
        Piece rook = board.getPieceAt(squares.rookStart());
        board.forceMove(squares.kingStart(), squares.kingEnd());
        board.forceMove(squares.rookStart(), squares.rookEnd());
        king.setHasMoved(true);
        rook.setHasMoved(true);
        enPassantTarget = null;
        return finalizeMove(PieceType.KING, new Move(squares.kingStart(), squares.kingEnd(), null, side), false, null);
    }

    private MoveResult finalizeMove(PieceType pieceType, Move move, boolean enPassant, PieceType pieceEaten) {
        Color mover = activePlayer;
        int turn = turnNumber;
        if(pieceType == PieceType.PAWN || pieceEaten != null) {
            halfMoveClock = 0;
        } else {
            halfMoveClock++;
        }
        if(mover == Color.BLACK) {
            turnNumber++;
        }
        activePlayer = mover.getOppositeColor();

        boolean check = isInCheck(activePlayer);
        boolean checkmate = check && isCheckmate(activePlayer);
        MovePlayed played = new MovePlayed(turn, mover, pieceType, move, enPassant, pieceEaten, check, checkmate);
        moveLog.add(played);
        log(turn + (mover == Color.WHITE ? ". " : "... ") + played);
        if(checkmate) {
            log("Checkmate, " + mover.displayName() + " wins");
        }
        return MoveResult.success(played);
    }

    // Explains why a piece capability check refused the move
    private MoveResult refuse(Piece piece, Location start, Location end) {
        if(!piece.isInMoveShape(end)) {
            return failure(MoveError.ILLEGAL_GEOMETRY, piece + " cannot reach " + end, start, end);
        }
        if(!board.isPathClear(start, end)) {
            List<Location> squares = new ObjectArrayList<>();
            squares.add(start);
            squares.add(end);
            for(Location square : Board.intermediateSquares(start, end)) {
                if(!board.isEmpty(square)) {
                    squares.add(square);
                }
            }
            return failure(MoveError.BLOCKED_PATH, "Path from " + start + " to " + end + " is blocked", squares);
        }
        if(piece.type() == PieceType.KING) {
            return failure(MoveError.SELF_CHECK, piece + " cannot move into check on " + end, start, end);
        }
        return failure(MoveError.ILLEGAL_GEOMETRY, piece + " cannot go to " + end, start, end);
    }

    private MoveResult checkPromotion(Piece piece, Location end, PieceType promotion) {
        if(piece.type() != PieceType.PAWN) {
            return failure(MoveError.PROMOTION_ERROR, "Cannot promote " + piece + ", it is not a pawn", piece.location());
        }
        if(end.getRank() != piece.color().promotionRank) {
            return failure(MoveError.PROMOTION_ERROR, "Pawns can only be promoted on rank " + piece.color().promotionRank, piece.location(), end);
        }
        if(!promotion.isPromotionTarget()) {
            return failure(MoveError.PROMOTION_ERROR, "Cannot promote a pawn to " + promotion, piece.location(), end);
        }
        return null;
    }

    /**
     * Replaces the pawn at location with a new piece of the given type. The pawn must already stand
     * on its last rank. Does not count as a move.
     */
    public Piece promotePawn(Location location, PieceType type) {
        Piece pawn = board.getPieceAt(location);
        if(pawn == null) {
            throw failure(MoveError.EMPTY_SOURCE, "There is no piece at " + location, location).asException();
        }
        MoveResult refused = checkPromotion(pawn, location, type);
        if(refused != null) {
            throw refused.asException();
        }
        Piece promoted = promote(pawn, type);
        log(pawn.color().displayName() + " promotes to " + type + " on " + location);
        return promoted;
    }

    private Piece promote(Piece pawn, PieceType type) {
        Location location = pawn.location();
        removePieceAt(location);
        Piece promoted = addPiece(type, pawn.color(), location);
        promoted.setHasMoved(true);
        return promoted;
    }

    private void capture(Piece target) {
        board.remove(target.location());
        registry(target.color()).remove(target);
        captured(target.color()).add(target);
    }

    public boolean hasCastlingRights(Color color, CastleSide side) {
        CastleSide.Squares squares = side.squares(color);
        Piece king = board.getPieceAt(squares.kingStart());
        Piece rook = board.getPieceAt(squares.rookStart());
        return king != null && king.type() == PieceType.KING && king.color() == color && !king.hasMoved()
                && rook != null && rook.type() == PieceType.ROOK && rook.color() == color && !rook.hasMoved();
    }

    /** Whether any live piece of byColor attacks square. The vacated square is considered empty. */
    public boolean isSquareAttacked(Location square, Color byColor, Location vacated) {
        for(Piece piece : registry(byColor)) {
            Location location = piece.location();
            if(location != null && !location.equals(square) && piece.attacks(square, board, vacated)) {
                return true;
            }
        }
        return false;
    }

    public boolean isInCheck(Color color) {
        Piece king = getKing(color);
        return king != null && isSquareAttacked(king.location(), color.getOppositeColor(), null);
    }

    public Piece getKing(Color color) {
        for(Piece piece : registry(color)) {
            if(piece.type() == PieceType.KING) {
                return piece;
            }
        }
        return null;
    }

    /**
     * True when the king of color has no square to go to among its neighbours. Only the king's own
     * escapes are considered: a block or a capture of the checking piece by another defender is not.
     */
    public boolean isCheckmate(Color color) {
        Piece king = getKing(color);
        if(king == null) {
            return false;
        }
        Location from = king.location();
        for(int[] delta : KING_NEIGHBOURS) {
            if(!from.canOffset(delta[0], delta[1])) {
                continue;
            }
            Location destination = from.offset(delta[0], delta[1]);
            if(board.isOccupiedBy(destination, color)) {
                continue;
            }
            if(king.canMoveTo(destination, this)) {
                return false;
            }
        }
        return true;
    }

    // Probes the player who just moved's opponent, i.e. the one not to move
    public boolean checkForCheckmate() {
        Color defender = activePlayer.getOppositeColor();
        boolean checkmate = isCheckmate(defender);
        if(checkmate) {
            log("Checkmate, " + defender.displayName() + " King has no escape");
        }
        return checkmate;
    }

    public TempMove tempMove() {
        TempMove scope = new TempMove(this, snapshot());
        scopes.push(scope);
        return scope;
    }

    void closeScope(TempMove scope) {
        if(scopes.peek() != scope) {
            throw new IllegalStateException("Rollback scopes must be closed in reverse order of opening");
        }
        scopes.pop();
        restore(scope.snapshot());
    }

    private GameSnapshot snapshot() {
        Reference2ObjectOpenHashMap<Piece, GameSnapshot.PieceState> states = new Reference2ObjectOpenHashMap<>(64);
        GameSnapshot.record(states, whitePieces);
        GameSnapshot.record(states, blackPieces);
        GameSnapshot.record(states, whiteCaptured);
        GameSnapshot.record(states, blackCaptured);
        return new GameSnapshot(board.copySquares(),
                new ObjectArrayList<>(whitePieces), new ObjectArrayList<>(blackPieces),
                new ObjectArrayList<>(whiteCaptured), new ObjectArrayList<>(blackCaptured),
                states, activePlayer, turnNumber, halfMoveClock, enPassantTarget, moveLog.size());
    }

    private void restore(GameSnapshot snapshot) {
        board.restoreSquares(snapshot.squares());
        resetTo(whitePieces, snapshot.whitePieces());
        resetTo(blackPieces, snapshot.blackPieces());
        resetTo(whiteCaptured, snapshot.whiteCaptured());
        resetTo(blackCaptured, snapshot.blackCaptured());
        snapshot.restorePieces();
        activePlayer = snapshot.activePlayer();
        turnNumber = snapshot.turnNumber();
        halfMoveClock = snapshot.halfMoveClock();
        enPassantTarget = snapshot.enPassantTarget();
        moveLog.removeElements(snapshot.moveCount(), moveLog.size());
    }

    private static void resetTo(ObjectArrayList<Piece> list, List<Piece> content) {
        list.clear();
        list.addAll(content);
    }

    private MoveResult failure(MoveError error, String message, Location... squares) {
        return failure(error, message, List.of(squares));
    }

    private MoveResult failure(MoveError error, String message, List<Location> squares) {
        return MoveResult.failure(error, message, squares, board.toAscii());
    }

    private ObjectArrayList<Piece> registry(Color color) {
        return color == Color.WHITE ? whitePieces : blackPieces;
    }

    private ObjectArrayList<Piece> captured(Color color) {
        return color == Color.WHITE ? whiteCaptured : blackCaptured;
    }

    // Rolled back probes stay silent
    private void log(String line) {
        if(scopes.isEmpty()) {
            log.accept(line);
        }
    }

    public List<Piece> getPieces(Color color) {
        return Collections.unmodifiableList(registry(color));
    }

    /** Pieces of color that were captured, in capture order. */
    public List<Piece> getCapturedPieces(Color color) {
        return Collections.unmodifiableList(captured(color));
    }

    public List<MovePlayed> getMoveLog() {
        return Collections.unmodifiableList(moveLog);
    }

    public MovePlayed getLastMove() {
        return moveLog.isEmpty() ? null : moveLog.get(moveLog.size() - 1);
    }

    public Color getActivePlayer() {
        return activePlayer;
    }

    public void setActivePlayer(Color activePlayer) {
        this.activePlayer = activePlayer;
    }

    public int getTurnNumber() {
        return turnNumber;
    }

    public void setTurnNumber(int turnNumber) {
        this.turnNumber = turnNumber;
    }

    public int getHalfMoveClock() {
        return halfMoveClock;
    }

    public void setHalfMoveClock(int halfMoveClock) {
        this.halfMoveClock = halfMoveClock;
    }

    public Location getEnPassantTarget() {
        return enPassantTarget;
    }

    public void setEnPassantTarget(Location enPassantTarget) {
        this.enPassantTarget = enPassantTarget;
    }

    public boolean hasOpenScope() {
        return !scopes.isEmpty();
    }

    @Override
    public String toString() {
        return board.toAscii() + "\n" + activePlayer.displayName() + " to move, turn " + turnNumber;
    }
}
