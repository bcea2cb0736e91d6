package games.klondike.console;

import games.klondike.cursor.Cursor;
import games.klondike.cursor.CursorZone;
import games.klondike.game.Card;
import games.klondike.game.GameState;
import games.klondike.session.GameController;
import games.klondike.session.GameSession;
import games.klondike.session.HighlightedDestinations;
import games.klondike.session.Selection;
import java.util.List;

/**
 * Plain-text view of a session for the console loop.
 * <p>
 * Marks the cursor with {@code >}, the selected pile with {@code *} and highlighted
 * destinations with {@code +}. Face-down cards show as {@code ##}.
 */
public class BoardFormatter {
    private static final int CELL_WIDTH = 6;

    private final GameController controller;

    public BoardFormatter(GameController controller) {
        this.controller = controller;
    }

    public String format() {
        GameSession session = controller.getSession();
        GameState state = session.getState();
        StringBuilder sb = new StringBuilder();
        sb.append("-".repeat(7 * (CELL_WIDTH + 2))).append('\n');

        sb.append(cell(session, CursorZone.STOCK, 0, state.getStock().isEmpty() ? "--" : "[" + state.getStock().size() + "]"));
        sb.append(cell(session, CursorZone.WASTE, 0, topLabel(state.getWaste())));
        sb.append(" ".repeat(CELL_WIDTH + 2));
        for (int i = 0; i < GameState.FOUNDATION_PILES; i++) {
            sb.append(cell(session, CursorZone.FOUNDATION, i, topLabel(state.getFoundation(i))));
        }
        sb.append('\n');

        int rows = 0;
        for (List<Card> pile : state.getTableau()) {
            rows = Math.max(rows, pile.size());
        }
        Cursor cursor = session.getCursor();
        for (int row = 0; row < Math.max(rows, 1); row++) {
            for (int p = 0; p < GameState.TABLEAU_PILES; p++) {
                List<Card> pile = state.getTableau(p);
                String label = row < pile.size() ? pile.get(row).toString() : (row == 0 ? "--" : "");
                boolean atCursor = cursor.getZone() == CursorZone.TABLEAU && cursor.getPileIndex() == p
                        && (row == cursor.getCardIndex() || (pile.isEmpty() && row == 0));
                sb.append(pad(marker(session, CursorZone.TABLEAU, p, atCursor) + label));
            }
            sb.append('\n');
        }

        sb.append("Moves: ").append(session.getMoveCount())
                .append("  Time: ").append((long) controller.getTimer().getElapsedSeconds()).append('s')
                .append("  Mode: ").append(session.getDrawMode())
                .append("  Status: ").append(session.getStatus());
        String selection = controller.describeSelection();
        if (!selection.isEmpty()) {
            sb.append("  Selected: ").append(selection);
        }
        sb.append('\n');
        if (session.getMessage() != null && !session.getMessage().isEmpty()) {
            sb.append(session.getMessage()).append('\n');
        }
        return sb.toString();
    }

    private String cell(GameSession session, CursorZone zone, int pile, String label) {
        Cursor cursor = session.getCursor();
        boolean atCursor = cursor.getZone() == zone && cursor.getPileIndex() == pile;
        return pad(marker(session, zone, pile, atCursor) + label);
    }

    private static String marker(GameSession session, CursorZone zone, int pile, boolean atCursor) {
        if (atCursor) {
            return ">";
        }
        Selection selection = session.getSelection();
        if (selection != null && selection.isAt(zone, pile)) {
            return "*";
        }
        HighlightedDestinations highlighted = session.getHighlighted();
        if (highlighted != null) {
            if ((zone == CursorZone.TABLEAU && highlighted.tableauPiles().contains(pile))
                    || (zone == CursorZone.FOUNDATION && highlighted.foundationPiles().contains(pile))) {
                return "+";
            }
        }
        return " ";
    }

    private static String topLabel(List<Card> pile) {
        return pile.isEmpty() ? "--" : pile.get(pile.size() - 1).toString();
    }

    private static String pad(String text) {
        StringBuilder sb = new StringBuilder(text);
        while (sb.length() < CELL_WIDTH + 2) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
