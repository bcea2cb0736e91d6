package games.klondike.game;

/**
 * How many cards a single stock draw turns over.
 * <p>
 * The two modes also differ in stall handling: a stalled draw-one game is lost at once,
 * while a stalled draw-three game may bury a stock card and try another pass.
 */
public enum DrawMode {
    DRAW_ONE(1),
    DRAW_THREE(3);

    private final int count;

    DrawMode(int count) {
        this.count = count;
    }

    /**
     * Returns the number of cards turned per draw.
     *
     * @return 1 or 3
     */
    public int getCount() {
        return count;
    }

    /**
     * Resolves a mode from a draw count.
     *
     * @param count 1 or 3
     * @return the matching mode
     * @throws IllegalArgumentException for any other count
     */
    public static DrawMode fromCount(int count) {
        for (DrawMode mode : values()) {
            if (mode.count == count) {
                return mode;
            }
        }
        throw new IllegalArgumentException("draw count must be 1 or 3, got " + count);
    }
}
