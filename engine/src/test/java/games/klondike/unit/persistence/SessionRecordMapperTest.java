package games.klondike.unit.persistence;

import static games.klondike.unit.helpers.SessionTestHelper.properties;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import games.klondike.game.DrawMode;
import games.klondike.persistence.SessionRecord;
import games.klondike.persistence.SessionRecordMapper;
import games.klondike.session.BuryDecision;
import games.klondike.session.GameAction;
import games.klondike.session.GameController;
import games.klondike.session.GameSession;
import games.klondike.session.SessionStatus;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Saving and resuming sessions through the JSON record.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>savedSessionResumesIdentically</b> - board, counters, draw mode and stall fields survive a save</li>
 *   <li><b>jsonUsesSnakeCaseKeys</b> - field names match the saved-game layout</li>
 *   <li><b>missingStallFieldsDefaultToFreshPass</b> - older saves resume with progress=true and no burials</li>
 *   <li><b>malformedInputRejected</b> - bad JSON, bad draw count or an incomplete deck are refused</li>
 * </ul>
 */
class SessionRecordMapperTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void savedSessionResumesIdentically() {
        GameController original = new GameController(properties(12L), BuryDecision.DECLINE);
        for (int i = 0; i < 24; i++) {
            original.handle(GameAction.STOCK_ACTION);
        }
        original.handle(GameAction.STOCK_ACTION);
        original.getTimer().setElapsed(42.0);
        GameSession saved = original.getSession();

        String json = SessionRecordMapper.toJson(SessionRecordMapper.toRecord(original));
        GameController resumed = new GameController(properties(99L), BuryDecision.DECLINE);
        SessionRecordMapper.restore(SessionRecordMapper.fromJson(json), resumed);

        GameSession session = resumed.getSession();
        assertEquals(saved.getState(), session.getState());
        assertEquals(24, session.getMoveCount());
        assertEquals(DrawMode.DRAW_ONE, session.getDrawMode());
        assertFalse(session.isMadeProgressSinceLastRecycle());
        assertEquals(0, session.getConsecutiveBurials());
        assertEquals(42.0, resumed.getTimer().getElapsedSeconds(), 1e-6);
        assertEquals(SessionStatus.PLAYING, session.getStatus());
        assertEquals("Game resumed.", session.getMessage());
        assertNull(session.getSeed());
        assertFalse(resumed.canUndo());
    }

    @Test
    void jsonUsesSnakeCaseKeys() throws Exception {
        GameController controller = new GameController(properties(4L), BuryDecision.DECLINE);
        ObjectNode node = (ObjectNode) JSON.readTree(SessionRecordMapper.toJson(SessionRecordMapper.toRecord(controller)));

        assertTrue(node.has("move_count"));
        assertTrue(node.has("elapsed_time"));
        assertEquals(1, node.get("draw_count").asInt());
        assertTrue(node.get("made_progress_since_last_recycle").asBoolean());
        assertEquals(0, node.get("consecutive_burials").asInt());
        assertEquals(24, node.get("state").get("stock").size());
        assertEquals(7, node.get("state").get("tableau").size());
        assertTrue(node.get("state").get("tableau").get(0).get(0).get("face_up").asBoolean());
        assertEquals(4, node.get("state").get("foundations").size());
        String suit = node.get("state").get("stock").get(0).get("suit").asText();
        assertTrue(List.of("hearts", "diamonds", "clubs", "spades").contains(suit), suit);
    }

    @Test
    void missingStallFieldsDefaultToFreshPass() throws Exception {
        GameController controller = new GameController(properties(4L), BuryDecision.DECLINE);
        ObjectNode node = (ObjectNode) JSON.readTree(SessionRecordMapper.toJson(SessionRecordMapper.toRecord(controller)));
        node.remove("made_progress_since_last_recycle");
        node.remove("consecutive_burials");
        node.put("draw_count", 3);

        SessionRecord record = SessionRecordMapper.fromJson(JSON.writeValueAsString(node));
        assertEquals(Boolean.TRUE, record.getMadeProgressSinceLastRecycle());
        assertEquals(0, record.getConsecutiveBurials());

        GameController resumed = new GameController(properties(1L), BuryDecision.DECLINE);
        SessionRecordMapper.restore(record, resumed);
        assertTrue(resumed.getSession().isMadeProgressSinceLastRecycle());
        assertEquals(DrawMode.DRAW_THREE, resumed.getSession().getDrawMode());
    }

    @Test
    void malformedInputRejected() throws Exception {
        GameController target = new GameController(properties(1L), BuryDecision.DECLINE);
        assertThrows(IllegalArgumentException.class, () -> SessionRecordMapper.fromJson("{not json"));
        assertThrows(IllegalArgumentException.class, () -> SessionRecordMapper.fromJson(" "));

        String valid = SessionRecordMapper.toJson(SessionRecordMapper.toRecord(target));

        ObjectNode badDraw = (ObjectNode) JSON.readTree(valid);
        badDraw.put("draw_count", 2);
        SessionRecord badDrawRecord = SessionRecordMapper.fromJson(JSON.writeValueAsString(badDraw));
        assertThrows(IllegalArgumentException.class, () -> SessionRecordMapper.restore(badDrawRecord, target));

        ObjectNode missingCard = (ObjectNode) JSON.readTree(valid);
        ((ArrayNode) missingCard.get("state").get("stock")).remove(0);
        SessionRecord missingCardRecord = SessionRecordMapper.fromJson(JSON.writeValueAsString(missingCard));
        assertThrows(IllegalArgumentException.class, () -> SessionRecordMapper.restore(missingCardRecord, target));

        ObjectNode badSuit = (ObjectNode) JSON.readTree(valid);
        ((ObjectNode) badSuit.get("state").get("stock").get(0)).put("suit", "stars");
        SessionRecord badSuitRecord = SessionRecordMapper.fromJson(JSON.writeValueAsString(badSuit));
        assertThrows(IllegalArgumentException.class, () -> SessionRecordMapper.restore(badSuitRecord, target));

        assertEquals(0, target.getSession().getMoveCount());
        assertEquals(SessionStatus.PLAYING, target.getSession().getStatus());
    }
}
