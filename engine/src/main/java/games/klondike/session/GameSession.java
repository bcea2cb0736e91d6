package games.klondike.session;

import games.klondike.cursor.Cursor;
import games.klondike.game.DrawMode;
import games.klondike.game.GameState;
import java.util.Objects;

/**
 * All mutable state of one game: the board, the cursor, the pending selection, counters,
 * the stall-tracking fields and the message shown to the player.
 * <p>
 * Owned by {@link GameController}, which is the only writer. Renderers read it through the
 * public getters.
 */
public final class GameSession {
    private GameState state;
    private final Cursor cursor;
    private final DrawMode drawMode;
    private final Long seed;

    private Selection selection;
    private HighlightedDestinations highlighted;
    private int moveCount;
    private String message;
    /** Whether any move succeeded since the waste was last recycled. */
    private boolean madeProgressSinceLastRecycle = true;
    /** Draw-three burials since the last successful move. */
    private int consecutiveBurials;
    private SessionStatus status = SessionStatus.PLAYING;

    GameSession(GameState state, DrawMode drawMode, Long seed, String message) {
        this.state = Objects.requireNonNull(state, "state");
        this.drawMode = Objects.requireNonNull(drawMode, "drawMode");
        this.seed = seed;
        this.cursor = new Cursor();
        this.message = message;
    }

    /**
     * Returns the live board. Callers outside the controller must treat it as read-only.
     */
    public GameState getState() {
        return state;
    }

    public Cursor getCursor() {
        return cursor;
    }

    public DrawMode getDrawMode() {
        return drawMode;
    }

    /**
     * Returns the seed the board was dealt from, or {@code null} for a restored game.
     */
    public Long getSeed() {
        return seed;
    }

    /**
     * Returns the pending selection, or {@code null} when idle.
     */
    public Selection getSelection() {
        return selection;
    }

    /**
     * Returns the destinations highlighted by the last hint request, or {@code null}.
     */
    public HighlightedDestinations getHighlighted() {
        return highlighted;
    }

    public int getMoveCount() {
        return moveCount;
    }

    public String getMessage() {
        return message;
    }

    public boolean isMadeProgressSinceLastRecycle() {
        return madeProgressSinceLastRecycle;
    }

    public int getConsecutiveBurials() {
        return consecutiveBurials;
    }

    public SessionStatus getStatus() {
        return status;
    }

    void setState(GameState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    void setSelection(Selection selection) {
        this.selection = selection;
    }

    void setHighlighted(HighlightedDestinations highlighted) {
        this.highlighted = highlighted;
    }

    void setMoveCount(int moveCount) {
        this.moveCount = moveCount;
    }

    void setMessage(String message) {
        this.message = message;
    }

    void setMadeProgressSinceLastRecycle(boolean madeProgressSinceLastRecycle) {
        this.madeProgressSinceLastRecycle = madeProgressSinceLastRecycle;
    }

    void setConsecutiveBurials(int consecutiveBurials) {
        this.consecutiveBurials = consecutiveBurials;
    }

    void setStatus(SessionStatus status) {
        this.status = status;
    }

    @Override
    public String toString() {
        return "GameSession{status=" + status
                + ", drawMode=" + drawMode
                + ", moves=" + moveCount
                + ", cursor=" + cursor
                + ", selection=" + selection
                + ", progress=" + madeProgressSinceLastRecycle
                + ", burials=" + consecutiveBurials + '}';
    }
}
