package games.klondike.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.klondike.game.Card;
import games.klondike.game.DrawMode;
import games.klondike.game.Rank;
import games.klondike.game.Suit;
import org.junit.jupiter.api.Test;

/**
 * Card, rank, suit and draw-mode value behaviour.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>faceDownCardHidesItsName</b> - toString shows "##" until the card is turned</li>
 *   <li><b>flipReturnsNewCard</b> - cards are immutable; flipping yields a new instance</li>
 *   <li><b>colourRules</b> - hearts/diamonds are red, clubs/spades black</li>
 *   <li><b>identityIgnoresFacing</b> - sameIdentity compares rank and suit only</li>
 *   <li><b>lookupsRejectUnknownValues</b> - Rank, Suit and DrawMode lookups fail loudly</li>
 * </ul>
 */
class CardTest {

    @Test
    void faceDownCardHidesItsName() {
        Card queen = new Card(Rank.QUEEN, Suit.HEARTS);
        assertFalse(queen.isFaceUp());
        assertEquals("##", queen.toString());
        assertEquals("Q♥", queen.shortName());
        assertEquals("Q♥", queen.faceUp().toString());
        assertEquals("10♠", new Card(Rank.TEN, Suit.SPADES, true).toString());
    }

    @Test
    void flipReturnsNewCard() {
        Card down = new Card(Rank.SEVEN, Suit.CLUBS);
        Card up = down.flip();
        assertFalse(down.isFaceUp());
        assertTrue(up.isFaceUp());
        assertSame(up, up.faceUp());
        assertSame(down, down.faceDown());
        assertNotEquals(down, up);
        assertEquals(down, up.faceDown());
    }

    @Test
    void colourRules() {
        assertTrue(Suit.HEARTS.isRed());
        assertTrue(Suit.DIAMONDS.isRed());
        assertTrue(Suit.CLUBS.isBlack());
        assertTrue(Suit.SPADES.isBlack());
        Card redSix = new Card(Rank.SIX, Suit.DIAMONDS);
        assertTrue(redSix.isOppositeColor(new Card(Rank.SEVEN, Suit.SPADES)));
        assertFalse(redSix.isOppositeColor(new Card(Rank.SEVEN, Suit.HEARTS)));
    }

    @Test
    void identityIgnoresFacing() {
        Card down = new Card(Rank.ACE, Suit.SPADES);
        assertTrue(down.sameIdentity(down.faceUp()));
        assertFalse(down.sameIdentity(new Card(Rank.ACE, Suit.CLUBS)));
        assertFalse(down.sameIdentity(null));
    }

    @Test
    void lookupsRejectUnknownValues() {
        assertEquals(Rank.KING, Rank.fromValue(13));
        assertEquals(Suit.DIAMONDS, Suit.fromName("Diamonds"));
        assertEquals(DrawMode.DRAW_THREE, DrawMode.fromCount(3));
        assertThrows(IllegalArgumentException.class, () -> Rank.fromValue(0));
        assertThrows(IllegalArgumentException.class, () -> Suit.fromName("stars"));
        assertThrows(IllegalArgumentException.class, () -> DrawMode.fromCount(2));
    }
}
