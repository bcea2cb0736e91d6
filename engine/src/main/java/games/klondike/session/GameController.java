package games.klondike.session;

import games.klondike.config.KlondikeProperties;
import games.klondike.cursor.Cursor;
import games.klondike.cursor.CursorNavigator;
import games.klondike.cursor.CursorZone;
import games.klondike.cursor.Direction;
import games.klondike.game.Card;
import games.klondike.game.Dealer;
import games.klondike.game.Deck;
import games.klondike.game.DrawMode;
import games.klondike.game.GameState;
import games.klondike.game.KlondikeRules;
import games.klondike.game.MoveExecutor;
import games.klondike.game.MoveResult;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a Klondike session: turns abstract {@link GameAction}s into cursor movement,
 * selections, moves, undo and stock handling, and tracks win and stall status.
 *
 * <p>The controller is the single owner of the {@link GameSession}. Each state-changing move
 * follows the same sequence:
 * <ol>
 *     <li>Snapshot the board and stall tracking onto the {@link UndoStack}.</li>
 *     <li>Ask {@link MoveExecutor} to apply the move; it validates with {@link KlondikeRules}.</li>
 *     <li>On failure, drop the snapshot again so no empty undo entry remains.</li>
 *     <li>On success, count the move, clear stall tracking and check for a win.</li>
 * </ol>
 *
 * <p><strong>Stall handling.</strong> When the stock is empty and the waste is not, a stock
 * action ends a pass. If some move succeeded during that pass the waste is recycled and
 * progress tracking starts over. If not, a draw-one game is lost; a draw-three game asks
 * the {@link BuryDecision} whether to bury a stock card and try again, and is lost after two
 * burials without progress or when the player declines.
 *
 * <p>Illegal input never throws; the reason is left in {@link GameSession#getMessage()}.
 */
public class GameController {
    private static final Logger log = LoggerFactory.getLogger(GameController.class);

    /** Burials allowed without progress before a draw-three game is declared lost. */
    static final int MAX_CONSECUTIVE_BURIALS = 2;

    private final KlondikeProperties properties;
    private final BuryDecision buryDecision;
    private final GameTimer timer;
    private final CursorNavigator navigator = new CursorNavigator();
    private final UndoStack undoStack;

    private GameSession session;

    public GameController(KlondikeProperties properties, BuryDecision buryDecision) {
        this(properties, buryDecision, new GameTimer());
    }

    /**
     * @param properties draw mode, seed and undo depth
     * @param buryDecision asked when a draw-three pass made no progress
     * @param timer elapsed-time source
     */
    public GameController(KlondikeProperties properties, BuryDecision buryDecision, GameTimer timer) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.buryDecision = Objects.requireNonNull(buryDecision, "buryDecision");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.undoStack = new UndoStack(properties.getUndoCapacity());
        this.session = newSession(properties.getSeed(), properties.getDrawMode(),
                "Welcome to Solitaire! Use arrows to move, Enter to select.");
    }

    public GameSession getSession() {
        return session;
    }

    public GameTimer getTimer() {
        return timer;
    }

    public boolean canUndo() {
        return undoStack.canUndo();
    }

    /** Starts the game clock. */
    public void startGame() {
        timer.start();
    }

    /**
     * Processes one action. Every action clears the highlighted destinations; only
     * {@link GameAction#SHOW_HINTS} sets new ones.
     *
     * @param action the decoded player action
     * @return {@code true} if the action did something, {@code false} if it was rejected
     */
    public boolean handle(GameAction action) {
        Objects.requireNonNull(action, "action");
        session.setHighlighted(null);
        if (session.getStatus().isOver() && action != GameAction.RESTART) {
            session.setMessage(gameOverMessage());
            return false;
        }
        switch (action) {
            case MOVE_UP:
                return moveCursor(Direction.UP);
            case MOVE_DOWN:
                return moveCursor(Direction.DOWN);
            case MOVE_LEFT:
                return moveCursor(Direction.LEFT);
            case MOVE_RIGHT:
                return moveCursor(Direction.RIGHT);
            case SELECT:
                return session.getSelection() == null ? select() : place();
            case PLACE:
                return place();
            case CANCEL:
                cancel();
                return true;
            case STOCK_ACTION:
                return handleStockAction().success;
            case UNDO:
                return undo();
            case RESTART:
                restart();
                return true;
            case SHOW_HINTS:
                Optional<HighlightedDestinations> highlights = computeValidDestinations();
                session.setHighlighted(highlights.orElse(null));
                return highlights.isPresent();
            default:
                throw new IllegalStateException("Unhandled action " + action);
        }
    }

    /**
     * Picks up the card(s) under the cursor. On the stock this performs the stock action
     * instead.
     *
     * @return {@code true} if a selection was made or the stock action succeeded
     */
    public boolean select() {
        session.setHighlighted(null);
        if (session.getStatus().isOver()) {
            session.setMessage(gameOverMessage());
            return false;
        }
        Cursor cursor = session.getCursor();
        GameState state = session.getState();
        switch (cursor.getZone()) {
            case STOCK:
                return handleStockAction().success;
            case WASTE:
                if (!KlondikeRules.canPickFromWaste(state)) {
                    session.setMessage("Waste is empty!");
                    return false;
                }
                session.setSelection(new Selection(CursorZone.WASTE, 0, 0));
                session.setMessage("Card selected. Press Tab to see placements, or move and Enter to place.");
                return true;
            case FOUNDATION:
                if (state.getFoundation(cursor.getPileIndex()).isEmpty()) {
                    session.setMessage("Foundation is empty!");
                    return false;
                }
                session.setSelection(new Selection(CursorZone.FOUNDATION, cursor.getPileIndex(), 0));
                session.setMessage("Foundation card selected. Press Tab to see placements.");
                return true;
            case TABLEAU:
                return selectFromTableau(cursor, state);
            default:
                throw new IllegalStateException("Unhandled zone " + cursor.getZone());
        }
    }

    /**
     * Places the current selection at the cursor. Placing back onto the source pile cancels
     * the selection instead.
     *
     * @return {@code true} if a move was made
     */
    public boolean place() {
        session.setHighlighted(null);
        if (session.getStatus().isOver()) {
            session.setMessage(gameOverMessage());
            return false;
        }
        Selection selection = session.getSelection();
        if (selection == null) {
            session.setMessage("Nothing selected!");
            return false;
        }
        Cursor cursor = session.getCursor();
        if (selection.isAt(cursor.getZone(), cursor.getPileIndex())) {
            cancel();
            return false;
        }
        switch (cursor.getZone()) {
            case STOCK:
                session.setMessage("Cannot place cards on stock!");
                return false;
            case WASTE:
                session.setMessage("Cannot place cards on waste!");
                return false;
            case FOUNDATION:
                return moveToFoundation(selection, cursor.getPileIndex());
            case TABLEAU:
                return moveToTableau(selection, cursor.getPileIndex());
            default:
                throw new IllegalStateException("Unhandled zone " + cursor.getZone());
        }
    }

    /** Clears any selection; safe to call when idle. */
    public void cancel() {
        session.setHighlighted(null);
        if (session.getSelection() != null) {
            session.setSelection(null);
            session.setMessage("Selection cancelled.");
        } else {
            session.setMessage("");
        }
    }

    /**
     * Draws from the stock, or ends the pass when the stock is empty by recycling the waste,
     * burying a card (draw-three) or declaring the game lost.
     *
     * @return the outcome; a loss is reported as a failure
     */
    public MoveResult handleStockAction() {
        session.setHighlighted(null);
        if (session.getStatus().isOver()) {
            session.setMessage(gameOverMessage());
            return MoveResult.failure(gameOverMessage());
        }
        GameState state = session.getState();
        session.setSelection(null);

        if (!state.getStock().isEmpty()) {
            return draw(state);
        }
        if (state.getWaste().isEmpty()) {
            session.setMessage("Both stock and waste are empty!");
            return MoveResult.failure("Both stock and waste are empty");
        }
        if (session.isMadeProgressSinceLastRecycle()) {
            return recycle(state);
        }
        return recoverFromStall(state);
    }

    /**
     * Restores the board and the stall-tracking fields from before the most recent move.
     *
     * @return {@code true} if a snapshot was restored
     */
    public boolean undo() {
        session.setHighlighted(null);
        if (session.getStatus().isOver()) {
            session.setMessage(gameOverMessage());
            return false;
        }
        Optional<UndoStack.Snapshot> saved = undoStack.pop();
        if (saved.isEmpty()) {
            session.setMessage("Nothing to undo!");
            return false;
        }
        UndoStack.Snapshot snapshot = saved.get();
        session.setState(snapshot.state());
        session.setMadeProgressSinceLastRecycle(snapshot.madeProgressSinceLastRecycle());
        session.setConsecutiveBurials(snapshot.consecutiveBurials());
        session.setMoveCount(Math.max(0, session.getMoveCount() - 1));
        session.setSelection(null);
        navigator.revalidate(session.getCursor(), session.getState());
        session.setMessage("Undone!");
        log.debug("Undo restored previous state; {} snapshot(s) left", undoStack.size());
        return true;
    }

    /**
     * Deals a new game with the configured seed (or a random one) and resets all counters.
     */
    public void restart() {
        newGame(properties.getSeed());
    }

    /**
     * Deals a new game from {@code seed}, clearing undo history, the timer and stall tracking.
     *
     * @param seed the deal seed, or null for a random deal
     */
    public void newGame(Long seed) {
        timer.reset();
        undoStack.clear();
        session = newSession(seed, session.getDrawMode(), "New game started!");
        timer.start();
    }

    /**
     * Replaces the whole session with a restored one, e.g. from a saved record.
     *
     * @param state the board to resume
     * @param moveCount moves already made
     * @param elapsedSeconds play time already elapsed
     * @param drawMode draw mode of the saved game
     * @param madeProgressSinceLastRecycle saved stall flag
     * @param consecutiveBurials saved burial count
     * @throws IllegalArgumentException if the board does not hold exactly one complete deck
     */
    public void restoreSession(GameState state, int moveCount, double elapsedSeconds, DrawMode drawMode,
                               boolean madeProgressSinceLastRecycle, int consecutiveBurials) {
        Objects.requireNonNull(state, "state");
        if (!state.hasCompleteDeck()) {
            throw new IllegalArgumentException("Restored state does not hold exactly one complete deck");
        }
        undoStack.clear();
        GameSession restored = new GameSession(state.copy(), drawMode, null, "Game resumed.");
        restored.setMoveCount(Math.max(0, moveCount));
        restored.setMadeProgressSinceLastRecycle(madeProgressSinceLastRecycle);
        restored.setConsecutiveBurials(Math.max(0, consecutiveBurials));
        session = restored;
        timer.setElapsed(elapsedSeconds);
        if (checkWin()) {
            restored.setStatus(SessionStatus.WON);
            timer.pause();
        }
    }

    /**
     * Checks the sole win condition: all 52 cards on the foundations.
     */
    public boolean checkWin() {
        return session.getState().foundationCardCount() == Deck.SIZE;
    }

    /**
     * Lists where the active card may go. The active card is the selected card when there is
     * a selection, otherwise the face-up card under the cursor. Foundations are left out for
     * multi-card tableau runs.
     *
     * @return the destinations, or empty (with a message) when there is no card or nowhere to go
     */
    public Optional<HighlightedDestinations> computeValidDestinations() {
        Optional<Card> active = session.getSelection() != null ? getSelectedCard() : getCardUnderCursor();
        if (active.isEmpty()) {
            session.setMessage("No card to show placements for!");
            return Optional.empty();
        }
        GameState state = session.getState();
        List<Integer> tableauDestinations = KlondikeRules.validTableauDestinations(active.get(), state);
        List<Integer> foundationDestinations = KlondikeRules.validFoundationDestinations(active.get(), state);

        Selection selection = session.getSelection();
        if (selection != null && selection.zone() == CursorZone.TABLEAU && selectedRunLength(selection) > 1) {
            foundationDestinations = List.of();
        }

        HighlightedDestinations highlights = new HighlightedDestinations(tableauDestinations, foundationDestinations);
        if (!highlights.hasAny()) {
            session.setMessage("No valid placements for this card!");
            return Optional.empty();
        }
        session.setMessage(highlights.count() + " valid placement(s) highlighted.");
        return Optional.of(highlights);
    }

    /**
     * Returns the face-up card under the cursor, if any. The stock never offers a card.
     */
    public Optional<Card> getCardUnderCursor() {
        Cursor cursor = session.getCursor();
        GameState state = session.getState();
        switch (cursor.getZone()) {
            case STOCK:
                return Optional.empty();
            case WASTE:
                return top(state.getWaste());
            case FOUNDATION:
                return top(state.getFoundation(cursor.getPileIndex()));
            case TABLEAU:
                List<Card> pile = state.getTableau(cursor.getPileIndex());
                int index = cursor.getCardIndex();
                if (index >= 0 && index < pile.size() && pile.get(index).isFaceUp()) {
                    return Optional.of(pile.get(index));
                }
                return Optional.empty();
            default:
                throw new IllegalStateException("Unhandled zone " + cursor.getZone());
        }
    }

    /**
     * Returns the selected card (the base card of a tableau run), if any.
     */
    public Optional<Card> getSelectedCard() {
        Selection selection = session.getSelection();
        if (selection == null) {
            return Optional.empty();
        }
        GameState state = session.getState();
        switch (selection.zone()) {
            case WASTE:
                return top(state.getWaste());
            case FOUNDATION:
                return top(state.getFoundation(selection.pileIndex()));
            case TABLEAU:
                List<Card> pile = state.getTableau(selection.pileIndex());
                if (selection.cardIndex() >= 0 && selection.cardIndex() < pile.size()) {
                    return Optional.of(pile.get(selection.cardIndex()));
                }
                return Optional.empty();
            case STOCK:
                return Optional.empty();
            default:
                throw new IllegalStateException("Unhandled zone " + selection.zone());
        }
    }

    /**
     * Describes the selection for a status line, e.g. "K♠" or "K♠ + 2 more".
     *
     * @return the description, "?" if the selection no longer points at a card, or "" when idle
     */
    public String describeSelection() {
        Selection selection = session.getSelection();
        if (selection == null) {
            return "";
        }
        Optional<Card> card = getSelectedCard();
        if (card.isEmpty()) {
            return "?";
        }
        if (selection.zone() == CursorZone.TABLEAU) {
            int run = selectedRunLength(selection);
            if (run > 1) {
                return card.get() + " + " + (run - 1) + " more";
            }
        }
        return card.get().toString();
    }

    private boolean moveCursor(Direction direction) {
        navigator.move(session.getCursor(), direction, session.getState());
        return true;
    }

    private boolean selectFromTableau(Cursor cursor, GameState state) {
        List<Card> pile = state.getTableau(cursor.getPileIndex());
        if (pile.isEmpty()) {
            session.setMessage("Tableau pile is empty!");
            return false;
        }
        if (!KlondikeRules.canPickFromTableau(pile, cursor.getCardIndex())) {
            session.setMessage("Cannot select face-down card!");
            return false;
        }
        session.setSelection(new Selection(CursorZone.TABLEAU, cursor.getPileIndex(), cursor.getCardIndex()));
        int count = pile.size() - cursor.getCardIndex();
        session.setMessage(count > 1
                ? count + " cards selected. Press Tab to see placements."
                : "Card selected. Press Tab to see placements.");
        return true;
    }

    private boolean moveToFoundation(Selection selection, int destFoundation) {
        switch (selection.zone()) {
            case FOUNDATION:
                session.setMessage("Cannot move foundation to foundation!");
                return false;
            case TABLEAU:
                if (selectedRunLength(selection) > 1) {
                    session.setMessage("Can only move single card to foundation!");
                    return false;
                }
                break;
            default:
                break;
        }

        pushUndo();
        GameState state = session.getState();
        MoveResult result;
        switch (selection.zone()) {
            case WASTE:
                result = MoveExecutor.moveWasteToFoundation(state, destFoundation);
                break;
            case TABLEAU:
                result = MoveExecutor.moveTableauToFoundation(state, selection.pileIndex(), destFoundation);
                break;
            default:
                result = MoveResult.failure("Invalid source");
                break;
        }
        return finishPlacement(result, "Moved to foundation!");
    }

    private boolean moveToTableau(Selection selection, int destPile) {
        pushUndo();
        GameState state = session.getState();
        MoveResult result;
        switch (selection.zone()) {
            case WASTE:
                result = MoveExecutor.moveWasteToTableau(state, destPile);
                break;
            case TABLEAU:
                result = MoveExecutor.moveTableauToTableau(state, selection.pileIndex(), selection.cardIndex(), destPile);
                break;
            case FOUNDATION:
                result = MoveExecutor.moveFoundationToTableau(state, selection.pileIndex(), destPile);
                break;
            default:
                result = MoveResult.failure("Invalid source");
                break;
        }
        return finishPlacement(result, "Moved!");
    }

    private boolean finishPlacement(MoveResult result, String successMessage) {
        if (!result.success) {
            undoStack.pop();
            session.setMessage("Invalid move: " + result.message);
            return false;
        }
        recordSuccessfulMove();
        session.setSelection(null);
        session.setMessage(successMessage);
        navigator.revalidate(session.getCursor(), session.getState());
        if (checkWin()) {
            session.setStatus(SessionStatus.WON);
            timer.pause();
            session.setMessage("Congratulations, you won in " + session.getMoveCount() + " moves!");
            log.debug("Game won after {} moves", session.getMoveCount());
        }
        return true;
    }

    private void pushUndo() {
        undoStack.push(session.getState(), session.isMadeProgressSinceLastRecycle(), session.getConsecutiveBurials());
    }

    private void recordSuccessfulMove() {
        session.setMoveCount(session.getMoveCount() + 1);
        session.setMadeProgressSinceLastRecycle(true);
        session.setConsecutiveBurials(0);
    }

    private MoveResult draw(GameState state) {
        int before = state.getStock().size();
        pushUndo();
        MoveResult result = MoveExecutor.drawFromStock(state, session.getDrawMode().getCount());
        if (!result.success) {
            undoStack.pop();
            session.setMessage(result.message);
            return result;
        }
        session.setMoveCount(session.getMoveCount() + 1);
        int drawn = before - state.getStock().size();
        session.setMessage("Drew " + drawn + " card(s) from stock.");
        return result;
    }

    private MoveResult recycle(GameState state) {
        pushUndo();
        MoveResult result = MoveExecutor.recycleWasteToStock(state);
        if (!result.success) {
            undoStack.pop();
            session.setMessage(result.message);
            return result;
        }
        session.setMadeProgressSinceLastRecycle(false);
        session.setMessage("Recycled waste to stock.");
        log.debug("Recycled waste; tracking progress for the next pass");
        return result;
    }

    /**
     * Ends a pass that made no progress. Draw-one loses at once; draw-three offers to bury
     * the top stock card unless the burial limit is used up.
     * <p>
     * A stall is only detected with an empty stock, so an accepted bury first recycles the
     * waste and then moves the new top of the stock to its bottom. Recycle and bury form a
     * single undo entry.
     */
    private MoveResult recoverFromStall(GameState state) {
        if (session.getDrawMode() == DrawMode.DRAW_ONE) {
            return declareLoss();
        }
        if (session.getConsecutiveBurials() >= MAX_CONSECUTIVE_BURIALS) {
            return declareLoss();
        }

        timer.pause();
        session.setMessage("No progress this pass. Bury top card? (Y/N)");
        boolean bury = buryDecision.shouldBury();
        timer.resume();
        if (!bury) {
            return declareLoss();
        }

        pushUndo();
        MoveResult recycled = MoveExecutor.recycleWasteToStock(state);
        if (!recycled.success) {
            undoStack.pop();
            session.setMessage(recycled.message);
            return recycled;
        }
        MoveExecutor.buryTopOfStock(state);
        session.setConsecutiveBurials(session.getConsecutiveBurials() + 1);
        session.setMadeProgressSinceLastRecycle(false);
        session.setMessage("Top card buried. Recycled waste to stock.");
        log.debug("Buried top stock card ({} consecutive burial(s))", session.getConsecutiveBurials());
        return MoveResult.success("Top card buried");
    }

    private MoveResult declareLoss() {
        session.setStatus(SessionStatus.LOST);
        session.setSelection(null);
        timer.pause();
        session.setMessage("No legal moves remain. Game over.");
        if (log.isDebugEnabled()) {
            log.debug("Game lost: mode={}, burials={}, moves={}",
                    session.getDrawMode(), session.getConsecutiveBurials(), session.getMoveCount());
        }
        return MoveResult.failure("No legal moves remain. Game over.");
    }

    private String gameOverMessage() {
        return session.getStatus() == SessionStatus.WON
                ? "You already won! Restart to play again."
                : "No legal moves remain. Game over. Restart to play again.";
    }

    private int selectedRunLength(Selection selection) {
        return session.getState().getTableau(selection.pileIndex()).size() - selection.cardIndex();
    }

    private GameSession newSession(Long seed, DrawMode drawMode, String message) {
        long dealSeed = seed != null ? seed : Dealer.newSeed();
        return new GameSession(Dealer.deal(dealSeed), drawMode, dealSeed, message);
    }

    private static Optional<Card> top(List<Card> pile) {
        return pile.isEmpty() ? Optional.empty() : Optional.of(pile.get(pile.size() - 1));
    }
}
