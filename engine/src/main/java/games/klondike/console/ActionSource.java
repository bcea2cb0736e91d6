package games.klondike.console;

import games.klondike.session.GameAction;
import games.klondike.session.GameSession;

/**
 * Supplies the next abstract action for the game loop.
 */
public interface ActionSource {

    /**
     * Provide the next action for the game loop.
     *
     * @param session the current session, for sources that want to show or inspect it
     * @return the next action, or null to signal the game should exit
     */
    GameAction nextAction(GameSession session);
}
