package games.klondike.unit;

import static games.klondike.unit.helpers.SessionTestHelper.properties;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.klondike.KlondikeApplication;
import games.klondike.console.ActionSource;
import games.klondike.session.BuryDecision;
import games.klondike.session.GameAction;
import games.klondike.session.GameController;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * The console game loop driven by a scripted action source, without starting Spring.
 */
class KlondikeApplicationTest {

    @Test
    void loopAppliesActionsUntilSourceEnds() {
        GameController controller = new GameController(properties(8L), BuryDecision.DECLINE);
        Deque<GameAction> script = new ArrayDeque<>(List.of(
                GameAction.STOCK_ACTION, GameAction.STOCK_ACTION, GameAction.UNDO, GameAction.MOVE_DOWN));
        ActionSource source = session -> script.poll();

        int processed = new KlondikeApplication(controller, source).play();

        assertEquals(4, processed);
        assertEquals(1, controller.getSession().getMoveCount());
        assertEquals(1, controller.getSession().getState().getWaste().size());
        assertTrue(controller.getTimer().isRunning());
    }
}
