package max.chess.rules.common;

public enum MoveError {
    INVALID_SQUARE,
    EMPTY_SOURCE,
    WRONG_TURN_OWNER,
    BLOCKED_PATH,
    // destination unreachable or not capturable by the piece's rules
    ILLEGAL_GEOMETRY,
    ILLEGAL_CAPTURE,
    SELF_CHECK,
    AMBIGUOUS_MOVE,
    NO_LEGAL_CANDIDATE,
    ILLEGAL_CASTLE,
    PROMOTION_ERROR
}
