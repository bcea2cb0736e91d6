package games.klondike.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import games.klondike.game.DrawMode;
import games.klondike.game.GameState;
import games.klondike.session.GameController;
import games.klondike.session.GameSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a running session to a {@link SessionRecord} and back, and records to JSON text.
 * <p>
 * Where the text is stored (files, slots) is up to the caller. Any record that cannot be
 * turned back into a playable session is rejected with an {@link IllegalArgumentException}.
 */
public final class SessionRecordMapper {
    private static final Logger log = LoggerFactory.getLogger(SessionRecordMapper.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private SessionRecordMapper() {
    }

    /**
     * Captures the controller's current session.
     *
     * @param controller the running controller
     * @return a detached record
     */
    public static SessionRecord toRecord(GameController controller) {
        GameSession session = controller.getSession();
        SessionRecord record = new SessionRecord();
        record.setState(GameStateRecord.from(session.getState()));
        record.setMoveCount(session.getMoveCount());
        record.setElapsedTime(controller.getTimer().getElapsedSeconds());
        record.setDrawCount(session.getDrawMode().getCount());
        record.setMadeProgressSinceLastRecycle(session.isMadeProgressSinceLastRecycle());
        record.setConsecutiveBurials(session.getConsecutiveBurials());
        return record;
    }

    /**
     * Replaces the controller's session with the one described by {@code record}.
     *
     * @param record the saved session; absent stall fields are migrated to their defaults
     * @param controller the controller to resume into
     * @throws IllegalArgumentException if the record is incomplete or its board is invalid
     */
    public static void restore(SessionRecord record, GameController controller) {
        if (record == null || record.getState() == null) {
            throw new IllegalArgumentException("Saved session has no board state");
        }
        if (record.getDrawCount() == null) {
            throw new IllegalArgumentException("Saved session has no draw count");
        }
        record.migrate();
        DrawMode drawMode = DrawMode.fromCount(record.getDrawCount());
        GameState state = record.getState().toGameState();
        controller.restoreSession(state, record.getMoveCount(), record.getElapsedTime(), drawMode,
                record.getMadeProgressSinceLastRecycle(), record.getConsecutiveBurials());
        if (log.isDebugEnabled()) {
            log.debug("Restored session: {} moves, {}s elapsed, {}", record.getMoveCount(),
                    record.getElapsedTime(), drawMode);
        }
    }

    public static String toJson(SessionRecord record) {
        try {
            return OBJECT_MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise session record", e);
        }
    }

    /**
     * Parses a record from JSON text and migrates absent stall-tracking fields.
     *
     * @param json the saved text
     * @return the migrated record
     * @throws IllegalArgumentException if the text is not a valid session record
     */
    public static SessionRecord fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Saved session text is empty");
        }
        try {
            return OBJECT_MAPPER.readValue(json, SessionRecord.class).migrate();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed saved session: " + e.getOriginalMessage(), e);
        }
    }
}
