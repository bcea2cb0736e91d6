package games.klondike.cursor;

import java.util.Objects;

/**
 * Focus position on the board: a zone, a pile within it and, for tableau piles, the card
 * the focus rests on.
 * <p>
 * Only {@link CursorNavigator} moves a cursor; everything else reads it.
 */
public final class Cursor {
    private CursorZone zone;
    private int pileIndex;
    private int cardIndex;

    /**
     * Creates a cursor resting on the stock.
     */
    public Cursor() {
        this(CursorZone.STOCK, 0, 0);
    }

    public Cursor(CursorZone zone, int pileIndex, int cardIndex) {
        this.zone = Objects.requireNonNull(zone, "zone");
        this.pileIndex = pileIndex;
        this.cardIndex = cardIndex;
    }

    public CursorZone getZone() {
        return zone;
    }

    public int getPileIndex() {
        return pileIndex;
    }

    /**
     * Returns the focused card index; meaningful only in the tableau zone.
     */
    public int getCardIndex() {
        return cardIndex;
    }

    void set(CursorZone zone, int pileIndex, int cardIndex) {
        this.zone = zone;
        this.pileIndex = pileIndex;
        this.cardIndex = cardIndex;
    }

    void setPileIndex(int pileIndex) {
        this.pileIndex = pileIndex;
    }

    void setCardIndex(int cardIndex) {
        this.cardIndex = cardIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cursor)) {
            return false;
        }
        Cursor other = (Cursor) o;
        return zone == other.zone && pileIndex == other.pileIndex && cardIndex == other.cardIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(zone, pileIndex, cardIndex);
    }

    @Override
    public String toString() {
        return "Cursor(" + zone + ", pile=" + pileIndex + ", card=" + cardIndex + ")";
    }
}
