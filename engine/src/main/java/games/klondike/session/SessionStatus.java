package games.klondike.session;

/** Lifecycle of a game session. */
public enum SessionStatus {
    /** Moves are accepted. */
    PLAYING,
    /** All 52 cards are on the foundations. */
    WON,
    /** The stall rules ended the game; only a restart is accepted. */
    LOST;

    public boolean isOver() {
        return this != PLAYING;
    }
}
