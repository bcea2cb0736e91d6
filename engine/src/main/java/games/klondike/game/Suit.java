package games.klondike.game;

/**
 * The four suits of a standard deck, each tagged red or black.
 * <p>
 * Declaration order is significant: it is the fixed foundation order (foundation 0 holds
 * Hearts, foundation 3 holds Spades) and the order in which a fresh deck is built before
 * shuffling. Tableau building alternates colours, so rules compare {@link #isRed()} rather
 * than suits.
 */
public enum Suit {
    /** Hearts, a red suit (♥). */
    HEARTS("♥", true),
    /** Diamonds, a red suit (♦). */
    DIAMONDS("♦", true),
    /** Clubs, a black suit (♣). */
    CLUBS("♣", false),
    /** Spades, a black suit (♠). */
    SPADES("♠", false);

    private final String symbol;
    private final boolean red;

    Suit(String symbol, boolean red) {
        this.symbol = symbol;
        this.red = red;
    }

    /**
     * Returns the Unicode symbol of this suit.
     *
     * @return the suit symbol (e.g., "♥", "♠")
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Checks whether this suit is red (Hearts or Diamonds).
     *
     * @return {@code true} if red; {@code false} if black
     */
    public boolean isRed() {
        return red;
    }

    /**
     * Checks whether this suit is black (Clubs or Spades).
     *
     * @return {@code true} if black; {@code false} if red
     */
    public boolean isBlack() {
        return !red;
    }

    /**
     * Looks up a suit by its lower-case name as used in persisted records ("hearts", "spades").
     *
     * @param name the suit name, case-insensitive
     * @return the matching suit
     * @throws IllegalArgumentException if the name matches no suit
     */
    public static Suit fromName(String name) {
        if (name != null) {
            for (Suit suit : values()) {
                if (suit.name().equalsIgnoreCase(name.trim())) {
                    return suit;
                }
            }
        }
        throw new IllegalArgumentException("Unknown suit: " + name);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
