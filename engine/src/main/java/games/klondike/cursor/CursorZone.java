package games.klondike.cursor;

/**
 * Board zones the cursor can focus.
 * <p>
 * Stock, waste and the four foundations share the top row; the seven tableau piles form
 * the row below.
 */
public enum CursorZone {
    STOCK,
    WASTE,
    FOUNDATION,
    TABLEAU;

    /**
     * Returns the number of piles in this zone.
     */
    public int pileCount() {
        switch (this) {
            case STOCK:
            case WASTE:
                return 1;
            case FOUNDATION:
                return 4;
            case TABLEAU:
                return 7;
            default:
                throw new IllegalStateException("Unhandled zone " + this);
        }
    }
}
