package games.klondike.game;

/**
 * The 13 ranks of a standard deck, Ace low (1) through King (13).
 * <p>
 * Foundations build upward one value at a time from {@link #ACE}; tableau piles build
 * downward one value at a time and only a {@link #KING} may start an empty pile.
 */
public enum Rank {
    ACE(1, "A"),
    TWO(2, "2"),
    THREE(3, "3"),
    FOUR(4, "4"),
    FIVE(5, "5"),
    SIX(6, "6"),
    SEVEN(7, "7"),
    EIGHT(8, "8"),
    NINE(9, "9"),
    TEN(10, "10"),
    JACK(11, "J"),
    QUEEN(12, "Q"),
    KING(13, "K");

    private final int value;
    private final String label;

    Rank(int value, String label) {
        this.value = value;
        this.label = label;
    }

    /**
     * Returns the numeric value of this rank.
     *
     * @return 1 for Ace through 13 for King
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the short display label (e.g., "A", "10", "K").
     *
     * @return the label
     */
    public String getLabel() {
        return label;
    }

    /**
     * Resolves a rank from its numeric value.
     *
     * @param value a value between 1 and 13
     * @return the matching rank
     * @throws IllegalArgumentException if the value is out of range
     */
    public static Rank fromValue(int value) {
        if (value < ACE.value || value > KING.value) {
            throw new IllegalArgumentException("Rank value out of range: " + value);
        }
        return values()[value - 1];
    }

    @Override
    public String toString() {
        return label;
    }
}
