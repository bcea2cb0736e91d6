package games.klondike.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * A standard 52-card deck, all cards face down.
 * <p>
 * The deck is built suit by suit in {@link Suit} declaration order, Ace through King, and
 * then shuffled with a {@link Random} seeded by the caller, so the same seed always yields
 * the same card order.
 */
public class Deck {
    /** Number of cards in a complete deck. */
    public static final int SIZE = 52;

    private final List<Card> cards = new ArrayList<>(SIZE);

    /**
     * Constructs an unshuffled deck in stable suit/rank order.
     */
    public Deck() {
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                cards.add(new Card(rank, suit, false));
            }
        }
    }

    /**
     * Constructs a deck shuffled deterministically by {@code seed}.
     *
     * @param seed the shuffle seed
     */
    public Deck(long seed) {
        this();
        shuffle(seed);
    }

    /**
     * Shuffles the cards in place using a generator seeded with {@code seed}.
     *
     * @param seed the shuffle seed
     */
    public void shuffle(long seed) {
        Collections.shuffle(cards, new Random(seed));
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Returns an unmodifiable view of the cards, first-dealt card first.
     *
     * @return the deck order
     */
    public List<Card> asUnmodifiableList() {
        return Collections.unmodifiableList(cards);
    }

    @Override
    public String toString() {
        return "Deck(size=" + cards.size() + ")";
    }
}
