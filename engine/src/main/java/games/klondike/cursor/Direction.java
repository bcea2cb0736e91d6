package games.klondike.cursor;

/** Directional cursor input. */
public enum Direction {
    UP,
    DOWN,
    LEFT,
    RIGHT
}
