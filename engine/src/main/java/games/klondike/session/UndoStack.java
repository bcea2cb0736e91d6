package games.klondike.session;

import games.klondike.game.GameState;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded history of {@link Snapshot}s: a board plus the stall-tracking fields in force when
 * it was taken.
 * <p>
 * Every pushed state is deep-copied, so later play never alters history. Once the capacity
 * is exceeded the oldest snapshot is evicted, keeping the most recent undo depth intact.
 */
public class UndoStack {
    /** Default number of snapshots retained. */
    public static final int DEFAULT_CAPACITY = 100;

    /**
     * One undo entry.
     *
     * @param state board copy
     * @param madeProgressSinceLastRecycle progress flag at the time of the push
     * @param consecutiveBurials burial count at the time of the push
     */
    public record Snapshot(GameState state, boolean madeProgressSinceLastRecycle, int consecutiveBurials) {
        public Snapshot {
            Objects.requireNonNull(state, "state");
        }
    }

    private final Deque<Snapshot> snapshots = new ArrayDeque<>();
    private final int capacity;

    public UndoStack() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity maximum snapshots retained; must be positive
     * @throws IllegalArgumentException if capacity is not positive
     */
    public UndoStack(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Undo capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Records a copy of {@code state}, with the stall-tracking fields, as the newest snapshot.
     *
     * @param state the state to copy
     * @param madeProgressSinceLastRecycle current progress flag
     * @param consecutiveBurials current burial count
     */
    public void push(GameState state, boolean madeProgressSinceLastRecycle, int consecutiveBurials) {
        snapshots.addLast(new Snapshot(state.copy(), madeProgressSinceLastRecycle, consecutiveBurials));
        while (snapshots.size() > capacity) {
            snapshots.removeFirst();
        }
    }

    /**
     * Removes and returns the newest snapshot.
     *
     * @return the snapshot, or empty when there is no history
     */
    public Optional<Snapshot> pop() {
        return Optional.ofNullable(snapshots.pollLast());
    }

    public boolean canUndo() {
        return !snapshots.isEmpty();
    }

    public void clear() {
        snapshots.clear();
    }

    public int size() {
        return snapshots.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
