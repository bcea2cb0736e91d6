package games.klondike.session;

/**
 * Asks the player whether to bury a stock card when a draw-three pass made no progress.
 * <p>
 * Called synchronously; the controller does not continue until an answer is returned.
 */
@FunctionalInterface
public interface BuryDecision {

    /** Always declines, so a stalled draw-three game is lost. */
    BuryDecision DECLINE = () -> false;

    /** Always accepts. */
    BuryDecision ACCEPT = () -> true;

    /**
     * @return {@code true} to bury the top stock card and play another pass,
     *         {@code false} to concede the game
     */
    boolean shouldBury();
}
