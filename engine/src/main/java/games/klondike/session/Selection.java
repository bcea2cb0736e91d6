package games.klondike.session;

import games.klondike.cursor.CursorZone;
import java.util.Objects;

/**
 * Source of a pending move, held between a select and the following place or cancel.
 *
 * @param zone zone the cards were picked from (waste, foundation or tableau)
 * @param pileIndex pile within the zone
 * @param cardIndex for tableau selections, the base card of the picked-up run; 0 otherwise
 */
public record Selection(CursorZone zone, int pileIndex, int cardIndex) {
    public Selection {
        Objects.requireNonNull(zone, "zone");
    }

    /**
     * Checks whether the selection came from the given zone and pile.
     */
    public boolean isAt(CursorZone otherZone, int otherPile) {
        return zone == otherZone && pileIndex == otherPile;
    }
}
