package max.chess.rules.pgn;

import max.chess.rules.common.MoveError;

/**
 * Outcome of replaying one game. On failure, failedToken is the SAN token that could not be played
 * (null when the game could not even be set up) and error its kind, null for anything that is not
 * a rule violation.
 */
public record ReplayResult(PgnGame game, boolean passed, int pliesPlayed, String failedToken,
                           MoveError error, String message, boolean checkmate, String finalFen) {

    public static ReplayResult passed(PgnGame game, int pliesPlayed, boolean checkmate, String finalFen) {
        return new ReplayResult(game, true, pliesPlayed, null, null, null, checkmate, finalFen);
    }

    public static ReplayResult failed(PgnGame game, int pliesPlayed, String failedToken, MoveError error, String message, String finalFen) {
        return new ReplayResult(game, false, pliesPlayed, failedToken, error, message, false, finalFen);
    }

    // Key used to tally failures per cause
    public String failureKind() {
        if(passed) {
            return null;
        }
        if(error != null) {
            return error.name();
        }
        return failedToken == null ? "SETUP" : "CRASH";
    }
}
