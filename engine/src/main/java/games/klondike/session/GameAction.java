package games.klondike.session;

/**
 * Abstract player actions, decoded from raw input by an external collaborator.
 */
public enum GameAction {
    MOVE_UP,
    MOVE_DOWN,
    MOVE_LEFT,
    MOVE_RIGHT,
    /** Select the card(s) under the cursor, or place the current selection there. */
    SELECT,
    /** Place the current selection at the cursor. */
    PLACE,
    CANCEL,
    /** Draw from the stock, or recycle the waste when the stock is empty. */
    STOCK_ACTION,
    UNDO,
    RESTART,
    /** Highlight every legal destination for the active card. */
    SHOW_HINTS
}
