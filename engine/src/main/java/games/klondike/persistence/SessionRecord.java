package games.klondike.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Plain structured record of a saved session, handed to and from external storage.
 * <p>
 * Records written before stall tracking existed lack {@code made_progress_since_last_recycle}
 * and {@code consecutive_burials}; {@link #migrate()} fills them with the defaults that
 * favour the player (progress made, no burials) so a resumed game is never lost on the spot.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionRecord {
    private GameStateRecord state;
    private int moveCount;
    private double elapsedTime;
    private Integer drawCount;
    private Boolean madeProgressSinceLastRecycle;
    private Integer consecutiveBurials;

    /**
     * Default constructor for JSON binding.
     */
    public SessionRecord() {
    }

    /**
     * Fills absent stall-tracking fields with their defaults.
     *
     * @return this record
     */
    public SessionRecord migrate() {
        if (madeProgressSinceLastRecycle == null) {
            madeProgressSinceLastRecycle = Boolean.TRUE;
        }
        if (consecutiveBurials == null) {
            consecutiveBurials = 0;
        }
        return this;
    }

    public GameStateRecord getState() {
        return state;
    }

    public void setState(GameStateRecord state) {
        this.state = state;
    }

    public int getMoveCount() {
        return moveCount;
    }

    public void setMoveCount(int moveCount) {
        this.moveCount = moveCount;
    }

    /**
     * Returns the elapsed play time in seconds.
     */
    public double getElapsedTime() {
        return elapsedTime;
    }

    public void setElapsedTime(double elapsedTime) {
        this.elapsedTime = elapsedTime;
    }

    public Integer getDrawCount() {
        return drawCount;
    }

    public void setDrawCount(Integer drawCount) {
        this.drawCount = drawCount;
    }

    public Boolean getMadeProgressSinceLastRecycle() {
        return madeProgressSinceLastRecycle;
    }

    public void setMadeProgressSinceLastRecycle(Boolean madeProgressSinceLastRecycle) {
        this.madeProgressSinceLastRecycle = madeProgressSinceLastRecycle;
    }

    public Integer getConsecutiveBurials() {
        return consecutiveBurials;
    }

    public void setConsecutiveBurials(Integer consecutiveBurials) {
        this.consecutiveBurials = consecutiveBurials;
    }
}
