package games.klondike.cursor;

import games.klondike.game.Card;
import games.klondike.game.GameState;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Directional state machine moving a {@link Cursor} across the four board zones.
 * <p>
 * Transitions come from a fixed zone-by-direction table:
 * <pre>
 *            LEFT              RIGHT             UP                     DOWN
 * STOCK      -                 WASTE             -                      TABLEAU[0]
 * WASTE      STOCK             FOUNDATION[0]     -                      TABLEAU[1]
 * FOUNDATION F[i-1] / WASTE    F[i+1] / -        -                      TABLEAU[min(5 + i/2, 6)]
 * TABLEAU    T[i-1] / -        T[i+1] / -        card-1 / zone above    card+1 / -
 * </pre>
 * The zone above tableau pile 0 is the stock, above pile 1 the waste, above piles 2-4
 * foundation 0, and above piles 5-6 foundation {@code min(pile - 5, 3)}.
 * <p>
 * Entering or changing tableau piles snaps the card focus to the first face-up card (0 for
 * an empty or all-face-down pile). The navigator only reads the board; it never fails.
 */
public final class CursorNavigator {
    private static final int LAST_FOUNDATION = GameState.FOUNDATION_PILES - 1;
    private static final int LAST_TABLEAU = GameState.TABLEAU_PILES - 1;

    @FunctionalInterface
    private interface Transition {
        void apply(Cursor cursor, GameState state);
    }

    private static final Transition STAY = (cursor, state) -> { };

    private final Map<CursorZone, Map<Direction, Transition>> table = new EnumMap<>(CursorZone.class);

    public CursorNavigator() {
        define(CursorZone.STOCK, STAY,
                (c, s) -> c.set(CursorZone.WASTE, 0, 0),
                STAY,
                (c, s) -> enterTableau(c, s, 0));

        define(CursorZone.WASTE,
                (c, s) -> c.set(CursorZone.STOCK, 0, 0),
                (c, s) -> c.set(CursorZone.FOUNDATION, 0, 0),
                STAY,
                (c, s) -> enterTableau(c, s, 1));

        define(CursorZone.FOUNDATION,
                (c, s) -> {
                    if (c.getPileIndex() > 0) {
                        c.setPileIndex(c.getPileIndex() - 1);
                    } else {
                        c.set(CursorZone.WASTE, 0, 0);
                    }
                },
                (c, s) -> {
                    if (c.getPileIndex() < LAST_FOUNDATION) {
                        c.setPileIndex(c.getPileIndex() + 1);
                    }
                },
                STAY,
                (c, s) -> enterTableau(c, s, Math.min(5 + c.getPileIndex() / 2, LAST_TABLEAU)));

        define(CursorZone.TABLEAU,
                (c, s) -> {
                    if (c.getPileIndex() > 0) {
                        enterTableau(c, s, c.getPileIndex() - 1);
                    }
                },
                (c, s) -> {
                    if (c.getPileIndex() < LAST_TABLEAU) {
                        enterTableau(c, s, c.getPileIndex() + 1);
                    }
                },
                this::tableauUp,
                (c, s) -> {
                    List<Card> pile = s.getTableau(c.getPileIndex());
                    if (!pile.isEmpty() && c.getCardIndex() < pile.size() - 1) {
                        c.setCardIndex(c.getCardIndex() + 1);
                    }
                });

        for (CursorZone zone : CursorZone.values()) {
            if (!table.containsKey(zone) || table.get(zone).size() != Direction.values().length) {
                throw new IllegalStateException("Cursor transition table incomplete for " + zone);
            }
        }
    }

    /**
     * Moves the cursor one step in {@code direction}.
     *
     * @param cursor the cursor to move
     * @param direction the input direction
     * @param state the board, read to find snap targets
     */
    public void move(Cursor cursor, Direction direction, GameState state) {
        table.get(cursor.getZone()).get(direction).apply(cursor, state);
    }

    /**
     * Returns the index of the first face-up card in the focused tableau pile, or 0 when the
     * cursor is elsewhere or the pile has none.
     */
    public int firstSelectableCardIndex(Cursor cursor, GameState state) {
        if (cursor.getZone() != CursorZone.TABLEAU) {
            return 0;
        }
        return firstFaceUp(state.getTableau(cursor.getPileIndex()));
    }

    /**
     * Raises the card focus to the first face-up card if it currently rests below it.
     */
    public void snapToSelectable(Cursor cursor, GameState state) {
        if (cursor.getZone() != CursorZone.TABLEAU) {
            return;
        }
        List<Card> pile = state.getTableau(cursor.getPileIndex());
        if (pile.isEmpty()) {
            cursor.setCardIndex(0);
            return;
        }
        int first = firstFaceUp(pile);
        if (cursor.getCardIndex() < first) {
            cursor.setCardIndex(first);
        }
    }

    /**
     * Brings the card focus back inside the focused tableau pile after the board changed
     * under it (a run moved away, an undo), then snaps it to a selectable card.
     */
    public void revalidate(Cursor cursor, GameState state) {
        if (cursor.getZone() != CursorZone.TABLEAU) {
            return;
        }
        List<Card> pile = state.getTableau(cursor.getPileIndex());
        if (cursor.getCardIndex() >= pile.size()) {
            cursor.setCardIndex(Math.max(0, pile.size() - 1));
        }
        snapToSelectable(cursor, state);
    }

    /**
     * Puts the cursor back on the stock.
     */
    public void reset(Cursor cursor) {
        cursor.set(CursorZone.STOCK, 0, 0);
    }

    private void tableauUp(Cursor cursor, GameState state) {
        if (cursor.getCardIndex() > firstSelectableCardIndex(cursor, state)) {
            cursor.setCardIndex(cursor.getCardIndex() - 1);
            return;
        }
        int pile = cursor.getPileIndex();
        if (pile == 0) {
            cursor.set(CursorZone.STOCK, 0, 0);
        } else if (pile == 1) {
            cursor.set(CursorZone.WASTE, 0, 0);
        } else if (pile <= 4) {
            cursor.set(CursorZone.FOUNDATION, 0, 0);
        } else {
            cursor.set(CursorZone.FOUNDATION, Math.min(pile - 5, LAST_FOUNDATION), 0);
        }
    }

    private void enterTableau(Cursor cursor, GameState state, int pileIndex) {
        cursor.set(CursorZone.TABLEAU, pileIndex, 0);
        snapToSelectable(cursor, state);
    }

    private void define(CursorZone zone, Transition left, Transition right, Transition up, Transition down) {
        Map<Direction, Transition> row = new EnumMap<>(Direction.class);
        row.put(Direction.LEFT, left);
        row.put(Direction.RIGHT, right);
        row.put(Direction.UP, up);
        row.put(Direction.DOWN, down);
        table.put(zone, row);
    }

    private static int firstFaceUp(List<Card> pile) {
        for (int i = 0; i < pile.size(); i++) {
            if (pile.get(i).isFaceUp()) {
                return i;
            }
        }
        return 0;
    }
}
