package games.klondike.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Complete card placement of a Klondike game: stock, waste, four foundations and seven
 * tableau piles.
 * <p>
 * <strong>Pile orientation:</strong> every pile is stored bottom-to-top, so the last element
 * is the "top". For the stock that is the next card to be drawn; for the waste it is the
 * most recently drawn (and only playable) card.
 * <p>
 * <strong>Invariant:</strong> each of the 52 (rank, suit) pairs appears exactly once across
 * all piles. Face-up state is carried on each {@link Card}.
 * <p>
 * <strong>Ownership:</strong> public getters return read-only views. Only {@link Dealer} and
 * {@link MoveExecutor} mutate piles, through the package-private accessors. Undo snapshots
 * are taken with {@link #copy()}, which never aliases the live piles.
 */
public final class GameState {
    /** Number of tableau piles. */
    public static final int TABLEAU_PILES = 7;
    /** Number of foundation piles. */
    public static final int FOUNDATION_PILES = 4;
    /** Suit accepted by each foundation, indexed by foundation pile. */
    public static final List<Suit> FOUNDATION_SUITS = List.of(Suit.HEARTS, Suit.DIAMONDS, Suit.CLUBS, Suit.SPADES);

    private final List<Card> stock = new ArrayList<>();
    private final List<Card> waste = new ArrayList<>();
    private final List<List<Card>> foundations = new ArrayList<>(FOUNDATION_PILES);
    private final List<List<Card>> tableau = new ArrayList<>(TABLEAU_PILES);

    /**
     * Constructs an empty board (no cards anywhere).
     */
    public GameState() {
        for (int i = 0; i < FOUNDATION_PILES; i++) {
            foundations.add(new ArrayList<>());
        }
        for (int i = 0; i < TABLEAU_PILES; i++) {
            tableau.add(new ArrayList<>());
        }
    }

    /**
     * Constructs a board from explicit piles, copying every list.
     * <p>
     * Only the pile counts are checked here; card conservation is checked separately with
     * {@link #hasCompleteDeck()} so tests and loaders can decide how strict to be.
     *
     * @param stock stock, bottom-to-top
     * @param waste waste, bottom-to-top
     * @param foundations exactly four foundation piles
     * @param tableau exactly seven tableau piles
     * @throws IllegalArgumentException if the pile counts are wrong
     */
    public GameState(List<Card> stock, List<Card> waste, List<List<Card>> foundations, List<List<Card>> tableau) {
        Objects.requireNonNull(stock, "stock");
        Objects.requireNonNull(waste, "waste");
        Objects.requireNonNull(foundations, "foundations");
        Objects.requireNonNull(tableau, "tableau");
        if (foundations.size() != FOUNDATION_PILES) {
            throw new IllegalArgumentException("Expected " + FOUNDATION_PILES + " foundations, got " + foundations.size());
        }
        if (tableau.size() != TABLEAU_PILES) {
            throw new IllegalArgumentException("Expected " + TABLEAU_PILES + " tableau piles, got " + tableau.size());
        }
        this.stock.addAll(stock);
        this.waste.addAll(waste);
        for (List<Card> pile : foundations) {
            this.foundations.add(new ArrayList<>(pile));
        }
        for (List<Card> pile : tableau) {
            this.tableau.add(new ArrayList<>(pile));
        }
    }

    /**
     * Creates an independent deep copy. Cards are immutable and shared; every pile list is new.
     *
     * @return a copy that shares no mutable structure with this state
     */
    public GameState copy() {
        return new GameState(stock, waste, foundations, tableau);
    }

    public List<Card> getStock() {
        return Collections.unmodifiableList(stock);
    }

    public List<Card> getWaste() {
        return Collections.unmodifiableList(waste);
    }

    /**
     * Returns one foundation pile, Ace first.
     *
     * @param index 0..3
     * @return a read-only view of the pile
     * @throws IndexOutOfBoundsException if index is out of range
     */
    public List<Card> getFoundation(int index) {
        return Collections.unmodifiableList(foundations.get(index));
    }

    public List<List<Card>> getFoundations() {
        return unmodifiablePiles(foundations);
    }

    /**
     * Returns one tableau pile, bottom card first.
     *
     * @param index 0..6
     * @return a read-only view of the pile
     * @throws IndexOutOfBoundsException if index is out of range
     */
    public List<Card> getTableau(int index) {
        return Collections.unmodifiableList(tableau.get(index));
    }

    public List<List<Card>> getTableau() {
        return unmodifiablePiles(tableau);
    }

    /**
     * Returns the total number of cards on all four foundations.
     */
    public int foundationCardCount() {
        int total = 0;
        for (List<Card> pile : foundations) {
            total += pile.size();
        }
        return total;
    }

    /**
     * Returns the total number of cards on the board.
     */
    public int totalCardCount() {
        int total = stock.size() + waste.size();
        for (List<Card> pile : foundations) {
            total += pile.size();
        }
        for (List<Card> pile : tableau) {
            total += pile.size();
        }
        return total;
    }

    /**
     * Checks that each of the 52 (rank, suit) pairs appears exactly once.
     *
     * @return {@code true} if the board holds a complete deck with no duplicates
     */
    public boolean hasCompleteDeck() {
        if (totalCardCount() != Deck.SIZE) {
            return false;
        }
        List<Set<Rank>> seen = new ArrayList<>();
        for (int i = 0; i < Suit.values().length; i++) {
            seen.add(EnumSet.noneOf(Rank.class));
        }
        for (Card card : allCards()) {
            if (!seen.get(card.getSuit().ordinal()).add(card.getRank())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns every card on the board: stock, waste, foundations, then tableau.
     */
    public List<Card> allCards() {
        List<Card> all = new ArrayList<>(Deck.SIZE);
        all.addAll(stock);
        all.addAll(waste);
        for (List<Card> pile : foundations) {
            all.addAll(pile);
        }
        for (List<Card> pile : tableau) {
            all.addAll(pile);
        }
        return all;
    }

    List<Card> stock() {
        return stock;
    }

    List<Card> waste() {
        return waste;
    }

    List<Card> foundation(int index) {
        return foundations.get(index);
    }

    List<Card> tableau(int index) {
        return tableau.get(index);
    }

    private static List<List<Card>> unmodifiablePiles(List<List<Card>> piles) {
        List<List<Card>> snapshot = new ArrayList<>(piles.size());
        for (List<Card> pile : piles) {
            snapshot.add(Collections.unmodifiableList(pile));
        }
        return Collections.unmodifiableList(snapshot);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GameState)) {
            return false;
        }
        GameState other = (GameState) o;
        return stock.equals(other.stock)
                && waste.equals(other.waste)
                && foundations.equals(other.foundations)
                && tableau.equals(other.tableau);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stock, waste, foundations, tableau);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("GameState{stock=").append(stock.size())
                .append(", waste=").append(waste)
                .append(", foundations=[");
        for (int i = 0; i < FOUNDATION_PILES; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            List<Card> pile = foundations.get(i);
            sb.append(pile.isEmpty() ? "--" : pile.get(pile.size() - 1).toString());
        }
        sb.append("], tableau=").append(tableau).append('}');
        return sb.toString();
    }
}
