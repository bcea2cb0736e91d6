package games.klondike.unit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import games.klondike.config.KlondikeProperties;
import games.klondike.game.DrawMode;
import org.junit.jupiter.api.Test;

/**
 * Defaults and validation of the {@code klondike.*} properties.
 */
class KlondikePropertiesTest {

    @Test
    void defaults() {
        KlondikeProperties properties = new KlondikeProperties();
        assertEquals(1, properties.getDrawCount());
        assertEquals(DrawMode.DRAW_ONE, properties.getDrawMode());
        assertNull(properties.getSeed());
        assertEquals(100, properties.getUndoCapacity());
    }

    @Test
    void drawCountMustBeOneOrThree() {
        KlondikeProperties properties = new KlondikeProperties();
        properties.setDrawCount(3);
        assertEquals(DrawMode.DRAW_THREE, properties.getDrawMode());
        assertThrows(IllegalArgumentException.class, () -> properties.setDrawCount(2));
        assertEquals(3, properties.getDrawCount());
    }

    @Test
    void undoCapacityMustBePositive() {
        KlondikeProperties properties = new KlondikeProperties();
        assertThrows(IllegalArgumentException.class, () -> properties.setUndoCapacity(0));
        properties.setUndoCapacity(5);
        assertEquals(5, properties.getUndoCapacity());
    }
}
