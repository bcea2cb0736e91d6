package games.klondike.unit.helpers;

import games.klondike.game.Card;
import games.klondike.game.GameState;
import games.klondike.game.Rank;
import games.klondike.game.Suit;
import java.util.ArrayList;
import java.util.List;

/**
 * Fluent builder for constructing {@link GameState} boards for tests.
 *
 * <p><strong>How to use</strong>
 * <pre>{@code
 * GameState state = GameStateBuilder
 *     .newBoard()
 *     .tableau("T1", "K♠")
 *     .tableau("T2", 1, "3♣", "Q♥")
 *     .foundation("F1", "A♥")
 *     .waste("3♠", "7♦")
 *     .stock("9♣")
 *     .build();
 * }
 * </pre>
 *
 * <p><strong>Ordering conventions</strong> (all lists are <em>bottom-to-top</em>): the last card
 * named for a pile is its top. Tableau cards are face up unless a face-up count is given, in
 * which case only that many cards at the top are face up. Foundation and waste cards are face
 * up, stock cards face down.
 *
 * <p><strong>Auto-fill:</strong> the engine assumes a complete 52-card deal, so {@link #build()}
 * places every card not named anywhere face down at the bottom of the stock (or of the waste,
 * or under a tableau pile, see {@link #fillRemainingIntoWaste()} and
 * {@link #fillRemainingUnder(String)}). The result is then validated with
 * {@link GameStateAssertions#assertValidState(GameState)}.
 */
public final class GameStateBuilder {
    private enum FillTarget { STOCK, WASTE, TABLEAU }

    private final List<List<Card>> tableau = new ArrayList<>();
    private final List<List<Card>> foundations = new ArrayList<>();
    private final List<Card> stock = new ArrayList<>();
    private final List<Card> waste = new ArrayList<>();

    private FillTarget fillTarget = FillTarget.STOCK;
    private int fillPile;

    private GameStateBuilder() {
        for (int i = 0; i < GameState.TABLEAU_PILES; i++) {
            tableau.add(new ArrayList<>());
        }
        for (int i = 0; i < GameState.FOUNDATION_PILES; i++) {
            foundations.add(new ArrayList<>());
        }
    }

    public static GameStateBuilder newBoard() {
        return new GameStateBuilder();
    }

    /**
     * Sets a tableau pile with all cards face up.
     */
    public GameStateBuilder tableau(String pile, String... cards) {
        return tableau(pile, cards.length, cards);
    }

    /**
     * Sets a tableau pile with an explicit face-up count.
     *
     * @param pile "T1".."T7"
     * @param faceUpCount number of cards at the top of the pile that are face up
     * @param cards bottom-to-top card list
     */
    public GameStateBuilder tableau(String pile, int faceUpCount, String... cards) {
        int idx = parseIndex(pile, 'T', GameState.TABLEAU_PILES);
        if (faceUpCount < 0 || faceUpCount > cards.length) {
            throw new IllegalArgumentException("Invalid faceUpCount=" + faceUpCount + " for " + pile);
        }
        List<Card> p = tableau.get(idx);
        p.clear();
        for (int i = 0; i < cards.length; i++) {
            Card card = parseCard(cards[i]);
            p.add(i >= cards.length - faceUpCount ? card.faceUp() : card);
        }
        return this;
    }

    /**
     * Sets a foundation pile. "F1".."F4" take hearts, diamonds, clubs, spades.
     */
    public GameStateBuilder foundation(String pile, String... cards) {
        List<Card> p = foundations.get(parseIndex(pile, 'F', GameState.FOUNDATION_PILES));
        p.clear();
        for (String c : cards) {
            p.add(parseCard(c).faceUp());
        }
        return this;
    }

    /**
     * Fills one foundation from Ace through {@code top}.
     */
    public GameStateBuilder foundationUpTo(String pile, Rank top) {
        int idx = parseIndex(pile, 'F', GameState.FOUNDATION_PILES);
        Suit suit = GameState.FOUNDATION_SUITS.get(idx);
        List<Card> p = foundations.get(idx);
        p.clear();
        for (Rank rank : Rank.values()) {
            if (rank.getValue() > top.getValue()) {
                break;
            }
            p.add(new Card(rank, suit, true));
        }
        return this;
    }

    public GameStateBuilder waste(String... cards) {
        waste.clear();
        for (String c : cards) {
            waste.add(parseCard(c).faceUp());
        }
        return this;
    }

    public GameStateBuilder stock(String... cards) {
        stock.clear();
        for (String c : cards) {
            stock.add(parseCard(c));
        }
        return this;
    }

    /**
     * Puts unnamed cards at the bottom of the waste (face up) instead of the stock.
     */
    public GameStateBuilder fillRemainingIntoWaste() {
        fillTarget = FillTarget.WASTE;
        return this;
    }

    /**
     * Puts unnamed cards face down underneath a tableau pile instead of into the stock.
     * If the pile names no cards of its own, the last filled card is turned face up.
     */
    public GameStateBuilder fillRemainingUnder(String pile) {
        fillTarget = FillTarget.TABLEAU;
        fillPile = parseIndex(pile, 'T', GameState.TABLEAU_PILES);
        return this;
    }

    public GameState build() {
        List<Card> named = new ArrayList<>();
        tableau.forEach(named::addAll);
        foundations.forEach(named::addAll);
        named.addAll(stock);
        named.addAll(waste);

        List<Card> remaining = new ArrayList<>();
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                Card card = new Card(rank, suit);
                if (named.stream().noneMatch(card::sameIdentity)) {
                    remaining.add(card);
                }
            }
        }

        List<Card> fullStock = new ArrayList<>(stock);
        List<Card> fullWaste = new ArrayList<>(waste);
        List<List<Card>> fullTableau = new ArrayList<>();
        tableau.forEach(p -> fullTableau.add(new ArrayList<>(p)));
        switch (fillTarget) {
            case WASTE:
                List<Card> faceUp = new ArrayList<>();
                remaining.forEach(c -> faceUp.add(c.faceUp()));
                fullWaste.addAll(0, faceUp);
                break;
            case TABLEAU:
                List<Card> target = fullTableau.get(fillPile);
                if (target.isEmpty() && !remaining.isEmpty()) {
                    int last = remaining.size() - 1;
                    remaining.set(last, remaining.get(last).faceUp());
                }
                target.addAll(0, remaining);
                break;
            default:
                fullStock.addAll(0, remaining);
                break;
        }

        GameState state = new GameState(fullStock, fullWaste, foundations, fullTableau);
        GameStateAssertions.assertValidState(state);
        return state;
    }

    /**
     * Parses "Q♥", "10♣" or "T♣" into a face-down card.
     */
    public static Card parseCard(String text) {
        if (text == null || text.length() < 2) {
            throw new IllegalArgumentException("Bad card: " + text);
        }
        String rankText = text.substring(0, text.length() - 1);
        String suitText = text.substring(text.length() - 1);
        Suit suit = null;
        for (Suit s : Suit.values()) {
            if (s.getSymbol().equals(suitText)) {
                suit = s;
            }
        }
        if (suit == null) {
            throw new IllegalArgumentException("Bad suit in card: " + text);
        }
        if (rankText.equals("T")) {
            rankText = "10";
        }
        for (Rank rank : Rank.values()) {
            if (rank.getLabel().equals(rankText)) {
                return new Card(rank, suit);
            }
        }
        throw new IllegalArgumentException("Bad rank in card: " + text);
    }

    /**
     * Parses a card and turns it face up.
     */
    public static Card up(String text) {
        return parseCard(text).faceUp();
    }

    private static int parseIndex(String code, char prefix, int count) {
        if (code == null || code.length() < 2 || Character.toUpperCase(code.charAt(0)) != prefix) {
            throw new IllegalArgumentException("Expected " + prefix + "1.." + prefix + count + " but got " + code);
        }
        int idx = Integer.parseInt(code.substring(1)) - 1;
        if (idx < 0 || idx >= count) {
            throw new IllegalArgumentException("Pile out of range: " + code);
        }
        return idx;
    }
}
