package games.klondike.game;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deals a new Klondike game from a seeded shuffle.
 * <p>
 * Cards are taken from the shuffled {@link Deck} in order. Tableau pile {@code i} receives
 * {@code i + 1} cards of which only the last is face up; the remaining 24 cards become the
 * stock, face down, with the last of them on top. The same seed always produces the same
 * board.
 */
public final class Dealer {
    private static final Logger log = LoggerFactory.getLogger(Dealer.class);

    private Dealer() {
    }

    /**
     * Deals a game from a freshly chosen random seed.
     *
     * @return the dealt state
     */
    public static GameState deal() {
        return deal(newSeed());
    }

    /**
     * Deals a game deterministically.
     *
     * @param seed the shuffle seed
     * @return the dealt state
     */
    public static GameState deal(long seed) {
        List<Card> shuffled = new Deck(seed).asUnmodifiableList();
        GameState state = new GameState();
        int next = 0;

        for (int pileIndex = 0; pileIndex < GameState.TABLEAU_PILES; pileIndex++) {
            List<Card> pile = state.tableau(pileIndex);
            for (int cardCount = 0; cardCount <= pileIndex; cardCount++) {
                Card card = shuffled.get(next++);
                // Only the last card dealt to each pile starts face up.
                pile.add(cardCount == pileIndex ? card.faceUp() : card);
            }
        }
        state.stock().addAll(shuffled.subList(next, shuffled.size()));

        if (log.isDebugEnabled()) {
            log.debug("Dealt game with seed {} ({} cards in stock)", seed, state.getStock().size());
        }
        return state;
    }

    /**
     * Returns a new random seed for a deal.
     */
    public static long newSeed() {
        return ThreadLocalRandom.current().nextLong();
    }
}
