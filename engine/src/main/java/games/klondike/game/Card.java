package games.klondike.game;

import java.util.Objects;

/**
 * A single playing card: a {@link Rank}, a {@link Suit} and a face-up flag.
 * <p>
 * Cards are immutable. Turning a card over produces a new instance via {@link #flip()};
 * piles replace the old instance with the flipped one. Equality includes the face-up
 * flag, so a face-down Five of Hearts is not equal to a face-up one. Use
 * {@link #sameIdentity(Card)} to compare rank and suit only.
 */
public final class Card {
    private final Rank rank;
    private final Suit suit;
    private final boolean faceUp;

    /**
     * Constructs a face-down card.
     *
     * @param rank the rank (must not be null)
     * @param suit the suit (must not be null)
     * @throws NullPointerException if rank or suit is null
     */
    public Card(Rank rank, Suit suit) {
        this(rank, suit, false);
    }

    /**
     * Constructs a card with an explicit face-up state.
     *
     * @param rank the rank (must not be null)
     * @param suit the suit (must not be null)
     * @param faceUp whether the card is face up
     * @throws NullPointerException if rank or suit is null
     */
    public Card(Rank rank, Suit suit, boolean faceUp) {
        this.rank = Objects.requireNonNull(rank, "rank");
        this.suit = Objects.requireNonNull(suit, "suit");
        this.faceUp = faceUp;
    }

    public Rank getRank() {
        return rank;
    }

    public Suit getSuit() {
        return suit;
    }

    public boolean isFaceUp() {
        return faceUp;
    }

    public boolean isRed() {
        return suit.isRed();
    }

    /**
     * Checks whether this card and {@code other} are of opposite colours.
     *
     * @param other the card to compare with (must not be null)
     * @return {@code true} if one is red and the other black
     */
    public boolean isOppositeColor(Card other) {
        return isRed() != other.isRed();
    }

    /**
     * Returns a new card with the face-up flag inverted.
     *
     * @return the flipped card; this instance is unchanged
     */
    public Card flip() {
        return new Card(rank, suit, !faceUp);
    }

    /**
     * Returns this card face up, reusing this instance when it already is.
     */
    public Card faceUp() {
        return faceUp ? this : flip();
    }

    /**
     * Returns this card face down, reusing this instance when it already is.
     */
    public Card faceDown() {
        return faceUp ? flip() : this;
    }

    /**
     * Checks whether this card has the same rank and suit as {@code other},
     * ignoring which way up either card lies.
     *
     * @param other the card to compare with; may be null
     * @return {@code true} if rank and suit match
     */
    public boolean sameIdentity(Card other) {
        return other != null && rank == other.rank && suit == other.suit;
    }

    /**
     * Returns the short name regardless of face-up state (e.g., "Q♠", "10♦").
     *
     * @return the rank label followed by the suit symbol
     */
    public String shortName() {
        return rank.getLabel() + suit.getSymbol();
    }

    /**
     * Returns the short name when face up, or "##" when face down.
     */
    @Override
    public String toString() {
        return faceUp ? shortName() : "##";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return rank == card.rank && suit == card.suit && faceUp == card.faceUp;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, suit, faceUp);
    }
}
