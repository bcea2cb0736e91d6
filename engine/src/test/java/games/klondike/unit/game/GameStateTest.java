package games.klondike.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.klondike.game.Card;
import games.klondike.game.Dealer;
import games.klondike.game.GameState;
import games.klondike.game.MoveExecutor;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Board container behaviour.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>copyIsIndependent</b> - mutating the original never shows through a copy</li>
 *   <li><b>gettersAreReadOnly</b> - callers cannot mutate piles through the public views</li>
 *   <li><b>pileCountsAreChecked</b> - the explicit constructor insists on 4 foundations and 7 piles</li>
 *   <li><b>completeDeckDetection</b> - duplicates and missing cards are noticed</li>
 * </ul>
 */
class GameStateTest {

    @Test
    void copyIsIndependent() {
        GameState original = Dealer.deal(5L);
        GameState copy = original.copy();
        assertEquals(original, copy);

        MoveExecutor.drawFromStock(original, 1);

        assertNotEquals(original, copy);
        assertEquals(24, copy.getStock().size());
        assertTrue(copy.getWaste().isEmpty());
    }

    @Test
    void gettersAreReadOnly() {
        GameState state = Dealer.deal(5L);
        assertThrows(UnsupportedOperationException.class, () -> state.getStock().clear());
        assertThrows(UnsupportedOperationException.class, () -> state.getTableau(0).clear());
        assertThrows(UnsupportedOperationException.class, () -> state.getFoundations().get(0).add(null));
    }

    @Test
    void pileCountsAreChecked() {
        List<List<Card>> three = List.of(List.of(), List.of(), List.of());
        List<List<Card>> seven = List.of(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
        assertThrows(IllegalArgumentException.class, () -> new GameState(List.of(), List.of(), three, seven));
        assertThrows(IllegalArgumentException.class, () -> new GameState(List.of(), List.of(), seven.subList(0, 4), three));
    }

    @Test
    void completeDeckDetection() {
        assertTrue(Dealer.deal(3L).hasCompleteDeck());
        assertFalse(new GameState().hasCompleteDeck());

        GameState dealt = Dealer.deal(3L);
        List<Card> stock = new java.util.ArrayList<>(dealt.getStock());
        stock.set(0, stock.get(1));
        GameState duplicated = new GameState(stock, dealt.getWaste(), dealt.getFoundations(), dealt.getTableau());
        assertEquals(52, duplicated.totalCardCount());
        assertFalse(duplicated.hasCompleteDeck());
    }
}
