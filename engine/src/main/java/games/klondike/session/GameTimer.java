package games.klondike.session;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Elapsed play time with pause and resume.
 * <p>
 * Time accumulates only while running. Pausing (for a prompt, or when the game ends) banks
 * the running interval; resuming starts a new one. {@link #setElapsed(double)} restores a
 * saved total.
 */
public class GameTimer {
    private final LongSupplier nanoClock;

    private long startNanos;
    private long accumulatedNanos;
    private boolean running;
    private boolean paused;

    public GameTimer() {
        this(System::nanoTime);
    }

    /**
     * @param nanoClock monotonic nanosecond source
     */
    public GameTimer(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    /** Starts the timer; no-op if already running. */
    public void start() {
        if (running) {
            return;
        }
        startNanos = nanoClock.getAsLong();
        running = true;
        paused = false;
    }

    /** Pauses the timer; no-op if not running. */
    public void pause() {
        if (!running) {
            return;
        }
        accumulatedNanos += nanoClock.getAsLong() - startNanos;
        running = false;
        paused = true;
    }

    /** Resumes a paused timer; no-op otherwise. */
    public void resume() {
        if (!paused) {
            return;
        }
        startNanos = nanoClock.getAsLong();
        running = true;
        paused = false;
    }

    /** Stops the timer and clears the elapsed total. */
    public void reset() {
        startNanos = 0L;
        accumulatedNanos = 0L;
        running = false;
        paused = false;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isPaused() {
        return paused;
    }

    /**
     * Returns the elapsed play time in seconds.
     */
    public double getElapsedSeconds() {
        long total = accumulatedNanos;
        if (running) {
            total += nanoClock.getAsLong() - startNanos;
        }
        return total / (double) TimeUnit.SECONDS.toNanos(1);
    }

    /**
     * Replaces the elapsed total, e.g. when resuming a saved game. Negative values count as zero.
     *
     * @param seconds the elapsed time to restore
     */
    public void setElapsed(double seconds) {
        accumulatedNanos = (long) (Math.max(0.0, seconds) * TimeUnit.SECONDS.toNanos(1));
        if (running) {
            startNanos = nanoClock.getAsLong();
        }
    }
}
