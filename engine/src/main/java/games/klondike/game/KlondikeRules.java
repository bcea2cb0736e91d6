package games.klondike.game;

import java.util.ArrayList;
import java.util.List;

/**
 * Side-effect-free Klondike legality checks.
 * <p>
 * <ul>
 *   <li><strong>Tableau:</strong> an empty pile takes only a King; otherwise the top card must
 *       be face up, of the opposite colour, and exactly one rank higher than the moving card.</li>
 *   <li><strong>Foundation:</strong> the card must match the foundation's suit; an empty pile
 *       takes only the Ace, otherwise the card must be exactly one rank higher than the top.</li>
 *   <li><strong>Picking:</strong> a tableau card can be picked up (with everything above it)
 *       only if it is face up; the waste offers its top card when non-empty.</li>
 * </ul>
 * Malformed input (null piles, out-of-range indices) answers {@code false} or an empty list.
 */
public final class KlondikeRules {
    private KlondikeRules() {
    }

    public static boolean canPlaceOnTableau(Card card, List<Card> pile) {
        if (card == null || pile == null) {
            return false;
        }
        if (pile.isEmpty()) {
            return card.getRank() == Rank.KING;
        }
        Card top = pile.get(pile.size() - 1);
        if (!top.isFaceUp()) {
            return false;
        }
        return card.isOppositeColor(top) && card.getRank().getValue() == top.getRank().getValue() - 1;
    }

    public static boolean canPlaceOnFoundation(Card card, List<Card> pile, Suit foundationSuit) {
        if (card == null || pile == null || card.getSuit() != foundationSuit) {
            return false;
        }
        if (pile.isEmpty()) {
            return card.getRank() == Rank.ACE;
        }
        Card top = pile.get(pile.size() - 1);
        return card.getRank().getValue() == top.getRank().getValue() + 1;
    }

    /**
     * Checks whether the run starting at {@code cardIndex} can be picked up.
     *
     * @param pile the tableau pile
     * @param cardIndex index of the base card of the run
     * @return {@code true} if the index is in bounds and that card is face up
     */
    public static boolean canPickFromTableau(List<Card> pile, int cardIndex) {
        if (pile == null || cardIndex < 0 || cardIndex >= pile.size()) {
            return false;
        }
        return pile.get(cardIndex).isFaceUp();
    }

    public static boolean canPickFromWaste(GameState state) {
        return !state.getWaste().isEmpty();
    }

    public static boolean canDrawFromStock(GameState state) {
        return !state.getStock().isEmpty();
    }

    /**
     * Lists every tableau pile that accepts {@code card}, in ascending pile order.
     *
     * @param card the moving card (base of the run for multi-card moves)
     * @param state the board
     * @return pile indices 0..6; empty when none accept the card
     */
    public static List<Integer> validTableauDestinations(Card card, GameState state) {
        List<Integer> valid = new ArrayList<>();
        for (int i = 0; i < GameState.TABLEAU_PILES; i++) {
            if (canPlaceOnTableau(card, state.getTableau(i))) {
                valid.add(i);
            }
        }
        return valid;
    }

    /**
     * Lists every foundation that accepts {@code card}, in ascending pile order.
     *
     * @param card the moving card
     * @param state the board
     * @return foundation indices 0..3; empty when none accept the card
     */
    public static List<Integer> validFoundationDestinations(Card card, GameState state) {
        List<Integer> valid = new ArrayList<>();
        for (int i = 0; i < GameState.FOUNDATION_PILES; i++) {
            if (canPlaceOnFoundation(card, state.getFoundation(i), GameState.FOUNDATION_SUITS.get(i))) {
                valid.add(i);
            }
        }
        return valid;
    }

    static boolean isTableauIndex(int index) {
        return index >= 0 && index < GameState.TABLEAU_PILES;
    }

    static boolean isFoundationIndex(int index) {
        return index >= 0 && index < GameState.FOUNDATION_PILES;
    }
}
