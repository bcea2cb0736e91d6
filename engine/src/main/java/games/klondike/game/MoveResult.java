package games.klondike.game;

/**
 * Outcome of a move attempt: a success flag and a short message for the player.
 * <p>
 * Failures never throw; a failed move leaves the board untouched and the message says why.
 */
public final class MoveResult {
    private static final MoveResult OK = new MoveResult(true, "");

    /** Whether the move was applied. */
    public final boolean success;

    /** Reason for failure, or an optional note on success; never null. */
    public final String message;

    private MoveResult(boolean success, String message) {
        this.success = success;
        this.message = message == null ? "" : message;
    }

    public static MoveResult success() {
        return OK;
    }

    public static MoveResult success(String message) {
        return new MoveResult(true, message);
    }

    public static MoveResult failure(String message) {
        return new MoveResult(false, message);
    }

    @Override
    public String toString() {
        return (success ? "success" : "failure") + (message.isEmpty() ? "" : ": " + message);
    }
}
