package games.klondike.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import games.klondike.game.Card;
import games.klondike.game.GameState;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted form of a {@link GameState}. Piles are stored bottom-to-top, as in the live model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GameStateRecord {
    private List<CardRecord> stock = new ArrayList<>();
    private List<CardRecord> waste = new ArrayList<>();
    private List<List<CardRecord>> foundations = new ArrayList<>();
    private List<List<CardRecord>> tableau = new ArrayList<>();

    /**
     * Default constructor for JSON binding.
     */
    public GameStateRecord() {
    }

    public static GameStateRecord from(GameState state) {
        GameStateRecord record = new GameStateRecord();
        record.stock = toRecords(state.getStock());
        record.waste = toRecords(state.getWaste());
        for (List<Card> pile : state.getFoundations()) {
            record.foundations.add(toRecords(pile));
        }
        for (List<Card> pile : state.getTableau()) {
            record.tableau.add(toRecords(pile));
        }
        return record;
    }

    /**
     * Rebuilds the board.
     *
     * @return a new game state
     * @throws IllegalArgumentException if pile counts or cards are invalid
     */
    public GameState toGameState() {
        List<List<Card>> foundationPiles = new ArrayList<>();
        for (List<CardRecord> pile : nonNull(foundations)) {
            foundationPiles.add(toCards(pile));
        }
        List<List<Card>> tableauPiles = new ArrayList<>();
        for (List<CardRecord> pile : nonNull(tableau)) {
            tableauPiles.add(toCards(pile));
        }
        return new GameState(toCards(stock), toCards(waste), foundationPiles, tableauPiles);
    }

    private static List<CardRecord> toRecords(List<Card> cards) {
        List<CardRecord> records = new ArrayList<>(cards.size());
        for (Card card : cards) {
            records.add(CardRecord.from(card));
        }
        return records;
    }

    private static List<Card> toCards(List<CardRecord> records) {
        List<Card> cards = new ArrayList<>();
        for (CardRecord record : nonNull(records)) {
            if (record == null) {
                throw new IllegalArgumentException("Null card in saved pile");
            }
            cards.add(record.toCard());
        }
        return cards;
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }

    public List<CardRecord> getStock() {
        return stock;
    }

    public void setStock(List<CardRecord> stock) {
        this.stock = stock;
    }

    public List<CardRecord> getWaste() {
        return waste;
    }

    public void setWaste(List<CardRecord> waste) {
        this.waste = waste;
    }

    public List<List<CardRecord>> getFoundations() {
        return foundations;
    }

    public void setFoundations(List<List<CardRecord>> foundations) {
        this.foundations = foundations;
    }

    public List<List<CardRecord>> getTableau() {
        return tableau;
    }

    public void setTableau(List<List<CardRecord>> tableau) {
        this.tableau = tableau;
    }
}
